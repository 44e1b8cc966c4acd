package org.usfx.tsv.util;

/**
 * Accumulates verse text from chunks with whitespace collapsed across chunk boundaries.
 *
 * <p>Any run of whitespace or control characters becomes a single space; leading and
 * trailing whitespace is never kept.
 */
class VerseText {

  private final StringBuilder sb = new StringBuilder();

  private boolean pendingSpace;

  static boolean isSeparator(char c) {
    return Character.isWhitespace(c) || Character.isISOControl(c);
  }

  void append(CharSequence chunk) {
    for (int i = 0; i < chunk.length(); i++) {
      char c = chunk.charAt(i);
      if (isSeparator(c)) {
        pendingSpace = true;
      } else {
        if (pendingSpace && sb.length() > 0) {
          sb.append(' ');
        }
        pendingSpace = false;
        sb.append(c);
      }
    }
  }

  /**
   * Word boundary without text, such as a paragraph break.
   */
  void separate() {
    pendingSpace = true;
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}

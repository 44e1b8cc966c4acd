package org.usfx.tsv.util;

public final class EncodeTsvText {

  private EncodeTsvText() { }

  /**
   * Encode TSV field. Tab, CR and LF would break the record so they become a space.
   * @param s string
   * @return encoded string
   */
  public static String encodeTsvField(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\t':
        case '\r':
        case '\n':
          sb.append(' ');
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Encode verse as TSV line: book, chapter, verse, text.
   * @param verseRecord verse
   * @return line without line terminator
   */
  public static String encodeRecord(VerseRecord verseRecord) {
    return encodeTsvField(verseRecord.getBook())
        + '\t' + verseRecord.getChapter()
        + '\t' + encodeTsvField(verseRecord.getVerse())
        + '\t' + encodeTsvField(verseRecord.getText());
  }
}

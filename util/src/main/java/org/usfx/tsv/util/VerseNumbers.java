package org.usfx.tsv.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of chapter numbers and verse numbers (including verse bridges).
 */
final class VerseNumbers {

  private static final Pattern NUMBER = Pattern.compile("\\d{1,9}");

  private static final Pattern VERSE = Pattern.compile("(\\d{1,9})(?:\\s*-\\s*(\\d{1,9}))?");

  private VerseNumbers() { }

  /**
   * Parse chapter number.
   * @param value attribute value; may be null
   * @param lineNumber source line for error message
   * @return chapter number, at least 1
   * @throws UsfxException INVALID_NUMERAL if not a positive integer
   */
  static int parseChapter(String value, int lineNumber) {
    if (value == null) {
      throw UsfxException.invalidNumeral(lineNumber, "Chapter without number");
    }
    String trimmed = value.trim();
    if (!NUMBER.matcher(trimmed).matches()) {
      throw UsfxException.invalidNumeral(lineNumber, "Bad chapter number '" + value + "'");
    }
    int chapter = Integer.parseInt(trimmed);
    if (chapter < 1) {
      throw UsfxException.invalidNumeral(lineNumber, "Bad chapter number '" + value + "'");
    }
    return chapter;
  }

  /**
   * Parse verse number or verse bridge.
   * @param value attribute value such as "6" or "6-7"; may be null
   * @param lineNumber source line for error message
   * @return verse number without leading zeros, bridge as "first-last"
   * @throws UsfxException INVALID_NUMERAL if not a positive integer or increasing bridge
   */
  static String parseVerse(String value, int lineNumber) {
    if (value == null) {
      throw UsfxException.invalidNumeral(lineNumber, "Verse without number");
    }
    Matcher m = VERSE.matcher(value.trim());
    if (!m.matches()) {
      throw UsfxException.invalidNumeral(lineNumber, "Bad verse number '" + value + "'");
    }
    int first = Integer.parseInt(m.group(1));
    if (first < 1) {
      throw UsfxException.invalidNumeral(lineNumber, "Bad verse number '" + value + "'");
    }
    if (m.group(2) == null) {
      return Integer.toString(first);
    }
    int last = Integer.parseInt(m.group(2));
    if (last <= first) {
      throw UsfxException.invalidNumeral(lineNumber, "Bad verse bridge '" + value + "'");
    }
    return first + "-" + last;
  }

  /**
   * Get verse part of a book.chapter.verse reference.
   * @param bcv reference such as "GEN.1.1"; may be null
   * @return last component; null if bcv is null or has no verse part
   */
  static String verseOfBcv(String bcv) {
    if (bcv == null) {
      return null;
    }
    String[] parts = bcv.trim().split("\\.");
    if (parts.length < 3) {
      return null;
    }
    return parts[parts.length - 1];
  }
}

package org.usfx.tsv.util;

import java.util.Objects;

/**
 * One verse: book code, chapter, verse number (or bridge) and plain text.
 */
public final class VerseRecord {

  private final String book;
  private final int chapter;
  private final String verse;
  private final String text;

  /**
   * Construct verse record.
   * @param book book code such as "GEN"
   * @param chapter chapter number, at least 1
   * @param verse verse number or bridge such as "6-7"
   * @param text verse text
   */
  public VerseRecord(String book, int chapter, String verse, String text) {
    this.book = Objects.requireNonNull(book, "book");
    this.chapter = chapter;
    this.verse = Objects.requireNonNull(verse, "verse");
    this.text = Objects.requireNonNull(text, "text");
  }

  public String getBook() {
    return book;
  }

  public int getChapter() {
    return chapter;
  }

  public String getVerse() {
    return verse;
  }

  public String getText() {
    return text;
  }

  public String toTsv() {
    return EncodeTsvText.encodeRecord(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VerseRecord)) {
      return false;
    }
    VerseRecord other = (VerseRecord) o;
    return chapter == other.chapter && book.equals(other.book)
        && verse.equals(other.verse) && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(book, chapter, verse, text);
  }

  @Override
  public String toString() {
    return book + " " + chapter + ":" + verse + " " + text;
  }
}

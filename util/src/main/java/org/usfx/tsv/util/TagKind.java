package org.usfx.tsv.util;

import java.util.Locale;

/**
 * What an element means to verse extraction.
 *
 * <p>BOOK, CHAPTER, VERSE, VERSE_END and BLOCK are structural, CONTENT is inline markup
 * whose text belongs to the verse and ANNOTATION is a subtree (footnote, cross reference,
 * heading) that contributes no verse text.
 */
public enum TagKind {
  BOOK,
  CHAPTER,
  VERSE,
  VERSE_END,
  BLOCK,
  CONTENT,
  ANNOTATION;

  public boolean isStructural() {
    return this != CONTENT && this != ANNOTATION;
  }

  /**
   * Get kind from its configuration label.
   * @param label lower or upper case name, such as "verse_end"
   * @return kind
   * @throws IllegalArgumentException for unknown label
   */
  public static TagKind fromLabel(String label) {
    if (label == null) {
      throw new IllegalArgumentException("Missing tag kind");
    }
    try {
      return valueOf(label.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown tag kind: '" + label + "'", e);
    }
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}

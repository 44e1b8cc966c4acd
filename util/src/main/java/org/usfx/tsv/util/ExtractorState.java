package org.usfx.tsv.util;

/**
 * Context reached by the verse extractor.
 */
public enum ExtractorState {
  IDLE,
  IN_BOOK,
  IN_CHAPTER,
  IN_VERSE
}

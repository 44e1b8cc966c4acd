package org.usfx.tsv.util;

import java.util.LinkedList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.usfx.tsv.util.readstream.Mapper;

/**
 * Folds structural events of one USFX document into verse records.
 *
 * <p>Book, chapter and verse elements may be containers ({@code <book>..</book>}) or
 * milestones ({@code <c id="1"/>}). Only a self-closing tag is a milestone; it leaves its
 * context open until the next element of the same kind. A container, even an empty one
 * such as {@code <v id="1"></v>}, closes its context at its end tag. Text is collected only
 * while a verse is open and outside annotation subtrees.
 *
 * <p>An instance handles a single document and a single failure: after an exception
 * the extractor must be discarded.
 */
public class VerseExtractor implements Mapper<StructuralEvent, VerseRecord> {
  private static final Logger log = LogManager.getLogger(VerseExtractor.class);

  private static final String ID_ATTRIBUTE = "id";

  private static final String BCV_ATTRIBUTE = "bcv";

  private final UsfxTags tags;

  private final List<VerseRecord> records = new LinkedList<>();

  private ExtractorState state = ExtractorState.IDLE;

  private String currentBook;

  private int currentChapter;

  private String pendingVerse;

  private VerseText pendingText;

  private int depth;

  private int skipDepth = -1;

  // self-closing structural element; its end tag closes nothing
  private String milestone;

  private boolean ended;

  private boolean failed;

  public VerseExtractor(UsfxTags tags) {
    this.tags = tags;
  }

  public ExtractorState getState() {
    return state;
  }

  public boolean isEnded() {
    return ended;
  }

  @Override
  public void push(StructuralEvent event) {
    if (ended) {
      throw new IllegalStateException("Extraction already done");
    }
    if (failed) {
      throw new IllegalStateException("Extraction already failed");
    }
    try {
      handle(event);
    } catch (UsfxException e) {
      failed = true;
      throw e;
    }
  }

  @Override
  public VerseRecord poll() {
    if (records.isEmpty()) {
      return null;
    }
    return records.remove(0);
  }

  @Override
  public void end() {
    if (ended) {
      throw new IllegalStateException("Extraction already done");
    }
    if (failed) {
      throw new IllegalStateException("Extraction already failed");
    }
    ended = true;
    flush();
    state = ExtractorState.IDLE;
  }

  private void handle(StructuralEvent event) {
    String opened = milestone;
    milestone = null;
    switch (event.getType()) {
      case START_ELEMENT:
        depth++;
        if (skipDepth < 0) {
          startElement(event);
        }
        break;
      case END_ELEMENT:
        if (skipDepth < 0) {
          endElement(event, event.getName().equals(opened));
        } else if (depth == skipDepth) {
          skipDepth = -1;
        }
        depth--;
        break;
      default:
        if (skipDepth < 0 && state == ExtractorState.IN_VERSE) {
          pendingText.append(event.getText());
        }
    }
  }

  private void startElement(StructuralEvent event) {
    TagKind kind = tags.kindOf(event.getName());
    switch (kind) {
      case BOOK:
        startBook(event);
        break;
      case CHAPTER:
        startChapter(event);
        break;
      case VERSE:
        startVerse(event);
        break;
      case VERSE_END:
        if (state == ExtractorState.IN_VERSE) {
          flush();
          state = ExtractorState.IN_CHAPTER;
        }
        break;
      case BLOCK:
        separate();
        break;
      case ANNOTATION:
        skipDepth = depth;
        break;
      default:
        break;
    }
    if (event.isEmptyElement() && kind.isStructural()) {
      milestone = event.getName();
    }
  }

  private void endElement(StructuralEvent event, boolean milestone) {
    TagKind kind = tags.kindOf(event.getName());
    if (kind == TagKind.BLOCK) {
      separate();
      return;
    }
    if (milestone) {
      return;
    }
    switch (kind) {
      case BOOK:
        flush();
        currentBook = null;
        currentChapter = 0;
        state = ExtractorState.IDLE;
        break;
      case CHAPTER:
        flush();
        currentChapter = 0;
        if (currentBook != null) {
          state = ExtractorState.IN_BOOK;
        }
        break;
      case VERSE:
        flush();
        if (currentChapter > 0) {
          state = ExtractorState.IN_CHAPTER;
        }
        break;
      default:
        break;
    }
  }

  private void startBook(StructuralEvent event) {
    flush();
    String id = event.getAttribute(ID_ATTRIBUTE);
    String book = id == null ? "" : id.trim();
    if (book.isEmpty()) {
      throw UsfxException.missingContext(event.getLineNumber(), "Book without id");
    }
    for (int i = 0; i < book.length(); i++) {
      if (VerseText.isSeparator(book.charAt(i))) {
        throw UsfxException.missingContext(event.getLineNumber(),
            "Bad book id '" + id + "'");
      }
    }
    log.debug("Book {}", book);
    currentBook = book;
    currentChapter = 0;
    state = ExtractorState.IN_BOOK;
  }

  private void startChapter(StructuralEvent event) {
    String id = event.getAttribute(ID_ATTRIBUTE);
    if (currentBook == null) {
      throw UsfxException.missingContext(event.getLineNumber(),
          "Chapter " + id + " outside book");
    }
    flush();
    currentChapter = VerseNumbers.parseChapter(id, event.getLineNumber());
    state = ExtractorState.IN_CHAPTER;
  }

  private void startVerse(StructuralEvent event) {
    String id = event.getAttribute(ID_ATTRIBUTE);
    if (id == null) {
      id = VerseNumbers.verseOfBcv(event.getAttribute(BCV_ATTRIBUTE));
    }
    if (currentBook == null || currentChapter == 0) {
      throw UsfxException.missingContext(event.getLineNumber(),
          "Verse " + id + " outside chapter");
    }
    flush();
    pendingVerse = VerseNumbers.parseVerse(id, event.getLineNumber());
    pendingText = new VerseText();
    state = ExtractorState.IN_VERSE;
  }

  private void separate() {
    if (state == ExtractorState.IN_VERSE) {
      pendingText.separate();
    }
  }

  private void flush() {
    if (pendingVerse == null) {
      return;
    }
    records.add(new VerseRecord(currentBook, currentChapter, pendingVerse,
        pendingText.toString()));
    pendingVerse = null;
    pendingText = null;
  }
}

package org.usfx.tsv.util;

import com.fasterxml.aalto.stax.InputFactoryImpl;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Blocking, lazy verse reader for a USFX document.
 *
 * <p>The document is read only as far as needed to produce the next verse. The reader
 * is single pass; it can not be restarted.
 */
public class UsfxVerseReader implements Iterator<VerseRecord>, Closeable {

  private final XMLStreamReader xmlReader;

  private final InputStream stream;

  private final VerseExtractor extractor;

  private VerseRecord next;

  /**
   * Create reader for USFX document.
   * @param stream document; closed by {@link #close()}, or here if reading fails
   * @param tags tag table
   * @throws UsfxException MALFORMED_XML if the XML prolog can not be read
   */
  public UsfxVerseReader(InputStream stream, UsfxTags tags) {
    this.stream = stream;
    this.extractor = new VerseExtractor(tags);
    XMLInputFactory factory = new InputFactoryImpl();
    try {
      xmlReader = factory.createXMLStreamReader(stream);
    } catch (XMLStreamException e) {
      UsfxException usfxException = UsfxException.malformedXml(e);
      try {
        stream.close();
      } catch (IOException closeException) {
        usfxException.addSuppressed(closeException);
      }
      throw usfxException;
    }
  }

  public UsfxVerseReader(InputStream stream) {
    this(stream, UsfxTags.defaults());
  }

  @Override
  public boolean hasNext() {
    while (next == null) {
      next = extractor.poll();
      if (next != null) {
        break;
      }
      if (extractor.isEnded()) {
        return false;
      }
      readEvent();
    }
    return true;
  }

  private void readEvent() {
    try {
      if (!xmlReader.hasNext()) {
        extractor.end();
        return;
      }
      int event = xmlReader.next();
      if (event == XMLStreamConstants.END_DOCUMENT) {
        extractor.end();
        return;
      }
      StructuralEvent structuralEvent = StructuralEvent.of(xmlReader);
      if (structuralEvent != null) {
        extractor.push(structuralEvent);
      }
    } catch (XMLStreamException e) {
      throw UsfxException.malformedXml(e);
    }
  }

  @Override
  public VerseRecord next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    VerseRecord verseRecord = next;
    next = null;
    return verseRecord;
  }

  /**
   * Verses as a sequential stream. Closing the stream closes this reader.
   * @return stream of remaining verses
   */
  public Stream<VerseRecord> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false)
        .onClose(() -> {
          try {
            close();
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        });
  }

  @Override
  public void close() throws IOException {
    try {
      xmlReader.close();
    } catch (XMLStreamException e) {
      throw new IOException(e);
    } finally {
      stream.close();
    }
  }
}

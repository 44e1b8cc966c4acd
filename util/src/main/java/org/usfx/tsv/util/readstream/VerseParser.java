package org.usfx.tsv.util.readstream;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.streams.ReadStream;
import javax.xml.stream.XMLStreamReader;
import org.usfx.tsv.util.UsfxTags;
import org.usfx.tsv.util.VerseRecord;

/**
 * Converts a USFX document to a stream of verse records.
 *
 * <p>Records are emitted in document order. The first error (malformed XML, missing
 * book or chapter context, bad verse number) is passed to the exception handler and the
 * end handler is never called.
 */
public class VerseParser extends MappingReadStream<VerseRecord, XMLStreamReader> {

  private VerseParser(ReadStream<XMLStreamReader> stream, UsfxTags tags) {
    super(stream, new VerseMapper(tags));
  }

  /**
   * Create verse parser for raw USFX bytes.
   * @param stream USFX document
   * @param tags tag table
   * @return parser; caller sets handlers
   */
  public static VerseParser newParser(ReadStream<Buffer> stream, UsfxTags tags) {
    return new VerseParser(XmlParser.newParser(stream), tags);
  }

  public static VerseParser newParser(ReadStream<Buffer> stream) {
    return newParser(stream, UsfxTags.defaults());
  }
}

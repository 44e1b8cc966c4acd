package org.usfx.tsv.util.readstream;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.usfx.tsv.util.StructuralEvent;
import org.usfx.tsv.util.UsfxException;
import org.usfx.tsv.util.UsfxTags;
import org.usfx.tsv.util.VerseExtractor;
import org.usfx.tsv.util.VerseRecord;

/**
 * Maps StAX events of a USFX document to verse records.
 */
public class VerseMapper implements Mapper<XMLStreamReader, VerseRecord> {

  private final VerseExtractor extractor;

  public VerseMapper(UsfxTags tags) {
    extractor = new VerseExtractor(tags);
  }

  @Override
  public void push(XMLStreamReader reader) {
    if (reader.getEventType() == XMLStreamConstants.END_DOCUMENT) {
      extractor.end();
      return;
    }
    StructuralEvent event;
    try {
      event = StructuralEvent.of(reader);
    } catch (XMLStreamException e) {
      throw UsfxException.malformedXml(e);
    }
    if (event != null) {
      extractor.push(event);
    }
  }

  @Override
  public VerseRecord poll() {
    return extractor.poll();
  }

  @Override
  public void end() {
    if (!extractor.isEnded()) {
      extractor.end();
    }
  }
}

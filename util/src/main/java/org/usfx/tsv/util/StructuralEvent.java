package org.usfx.tsv.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.codehaus.stax2.XMLStreamReader2;

/**
 * Tokenizer-independent XML event: element start, element end or text chunk.
 */
public final class StructuralEvent {

  public enum Type {
    START_ELEMENT,
    END_ELEMENT,
    TEXT
  }

  private final Type type;
  private final String name;
  private final Map<String, String> attributes;
  private final String text;
  private final int lineNumber;
  private final boolean emptyElement;

  private StructuralEvent(Type type, String name, Map<String, String> attributes,
      String text, int lineNumber, boolean emptyElement) {
    this.type = type;
    this.name = name;
    this.attributes = attributes;
    this.text = text;
    this.lineNumber = lineNumber;
    this.emptyElement = emptyElement;
  }

  public static StructuralEvent startElement(String name, Map<String, String> attributes) {
    return startElement(name, attributes, -1);
  }

  public static StructuralEvent startElement(String name, Map<String, String> attributes,
      int lineNumber) {
    return startElement(name, attributes, lineNumber, false);
  }

  /**
   * Element start.
   * @param name local name
   * @param attributes attributes by local name
   * @param lineNumber source line; -1 if unknown
   * @param emptyElement true for a self-closing tag ({@code <c id="1"/>})
   * @return event
   */
  public static StructuralEvent startElement(String name, Map<String, String> attributes,
      int lineNumber, boolean emptyElement) {
    return new StructuralEvent(Type.START_ELEMENT, name,
        Collections.unmodifiableMap(new LinkedHashMap<>(attributes)), null, lineNumber,
        emptyElement);
  }

  public static StructuralEvent endElement(String name) {
    return endElement(name, -1);
  }

  public static StructuralEvent endElement(String name, int lineNumber) {
    return new StructuralEvent(Type.END_ELEMENT, name, Collections.emptyMap(), null,
        lineNumber, false);
  }

  public static StructuralEvent text(String text) {
    return text(text, -1);
  }

  public static StructuralEvent text(String text, int lineNumber) {
    return new StructuralEvent(Type.TEXT, null, Collections.emptyMap(), text, lineNumber,
        false);
  }

  /**
   * Copy the current event of a StAX reader.
   * @param reader positioned reader; not advanced
   * @return event; null for events without meaning for extraction (comments, PIs, ..)
   * @throws XMLStreamException if the reader can not tell whether an element is empty
   */
  public static StructuralEvent of(XMLStreamReader reader) throws XMLStreamException {
    int line = lineNumber(reader);
    switch (reader.getEventType()) {
      case XMLStreamConstants.START_ELEMENT:
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
          attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        return new StructuralEvent(Type.START_ELEMENT, reader.getLocalName(),
            Collections.unmodifiableMap(attributes), null, line, isEmptyElement(reader));
      case XMLStreamConstants.END_ELEMENT:
        return endElement(reader.getLocalName(), line);
      case XMLStreamConstants.CHARACTERS:
      case XMLStreamConstants.CDATA:
      case XMLStreamConstants.SPACE:
        return text(reader.getText(), line);
      default:
        return null;
    }
  }

  // plain StAX readers can not tell <v/> from <v></v>
  private static boolean isEmptyElement(XMLStreamReader reader) throws XMLStreamException {
    return reader instanceof XMLStreamReader2 && ((XMLStreamReader2) reader).isEmptyElement();
  }

  private static int lineNumber(XMLStreamReader reader) {
    Location location = reader.getLocation();
    return location == null ? -1 : location.getLineNumber();
  }

  public Type getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public String getAttribute(String name) {
    return attributes.get(name);
  }

  public String getText() {
    return text;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public boolean isEmptyElement() {
    return emptyElement;
  }

  @Override
  public String toString() {
    switch (type) {
      case START_ELEMENT:
        return "<" + name + " " + attributes + (emptyElement ? "/>" : ">");
      case END_ELEMENT:
        return "</" + name + ">";
      default:
        return text;
    }
  }
}

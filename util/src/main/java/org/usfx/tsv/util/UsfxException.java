package org.usfx.tsv.util;

import javax.xml.stream.XMLStreamException;

/**
 * Terminal failure of a USFX conversion.
 */
public class UsfxException extends RuntimeException {

  public enum ErrorKind {
    /** Tokenizer could not produce well-formed events. */
    MALFORMED_XML,
    /** Chapter or verse marker without enclosing book or chapter. */
    MISSING_CONTEXT,
    /** Chapter or verse attribute is not a number or verse bridge. */
    INVALID_NUMERAL
  }

  private final ErrorKind errorKind;

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  public static UsfxException malformedXml(XMLStreamException e) {
    return new UsfxException(ErrorKind.MALFORMED_XML, e.getMessage(), e);
  }

  public static UsfxException missingContext(int lineNumber, String msg) {
    return new UsfxException(ErrorKind.MISSING_CONTEXT, withLine(lineNumber, msg), null);
  }

  public static UsfxException invalidNumeral(int lineNumber, String msg) {
    return new UsfxException(ErrorKind.INVALID_NUMERAL, withLine(lineNumber, msg), null);
  }

  private static String withLine(int lineNumber, String msg) {
    if (lineNumber < 0) {
      return msg;
    }
    return "Line " + lineNumber + ": " + msg;
  }

  public UsfxException(ErrorKind errorKind, String msg, Throwable cause) {
    super(msg, cause);
    this.errorKind = errorKind;
  }

}

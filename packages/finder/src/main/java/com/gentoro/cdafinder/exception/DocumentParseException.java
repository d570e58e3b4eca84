package com.gentoro.cdafinder.exception;

/** The CDA document could not be read or is not well-formed XML. Always fatal for a run. */
public class DocumentParseException extends CdaFinderException {
  public DocumentParseException(String message) {
    super(CdaFinderErrorCode.PARSE_ERROR, message);
  }

  public DocumentParseException(String message, Throwable cause) {
    super(CdaFinderErrorCode.PARSE_ERROR, message, cause);
  }
}

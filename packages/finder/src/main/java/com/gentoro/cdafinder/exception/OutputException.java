package com.gentoro.cdafinder.exception;

/** Rendering or writing results failed. */
public class OutputException extends CdaFinderException {
  public OutputException(String message, Throwable cause) {
    super(CdaFinderErrorCode.OUTPUT_ERROR, message, cause);
  }
}

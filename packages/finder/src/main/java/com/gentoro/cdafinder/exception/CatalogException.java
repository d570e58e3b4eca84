package com.gentoro.cdafinder.exception;

/** Errors while reading an expression catalog or a reference document. */
public class CatalogException extends CdaFinderException {
  public CatalogException(String message) {
    super(CdaFinderErrorCode.CATALOG_ERROR, message);
  }

  public CatalogException(String message, Throwable cause) {
    super(CdaFinderErrorCode.CATALOG_ERROR, message, cause);
  }
}

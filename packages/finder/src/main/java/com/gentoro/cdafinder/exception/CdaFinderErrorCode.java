package com.gentoro.cdafinder.exception;

/** Stable error categories reported by {@link CdaFinderException} and its subclasses. */
public enum CdaFinderErrorCode {
  PARSE_ERROR,
  CONVERSION_ERROR,
  CATALOG_ERROR,
  CONFIG_ERROR,
  OUTPUT_ERROR,
  UNKNOWN
}

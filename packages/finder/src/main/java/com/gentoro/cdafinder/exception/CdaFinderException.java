package com.gentoro.cdafinder.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the finder. Every failure carries a {@link CdaFinderErrorCode} and
 * an optional context map (file names, expressions) that is preserved by {@link
 * ExceptionUtil#toErrorDetails(Throwable)}.
 */
public class CdaFinderException extends RuntimeException {
  private final CdaFinderErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public CdaFinderException(CdaFinderErrorCode code, String message) {
    super(message);
    this.code = code == null ? CdaFinderErrorCode.UNKNOWN : code;
  }

  public CdaFinderException(CdaFinderErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? CdaFinderErrorCode.UNKNOWN : code;
  }

  public CdaFinderErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public CdaFinderException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}

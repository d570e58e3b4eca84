package com.gentoro.cdafinder.expression;

import com.gentoro.cdafinder.exception.CdaFinderErrorCode;
import com.gentoro.cdafinder.exception.CdaFinderException;

/**
 * A raw path expression could not be turned into a {@link ConvertedExpression}.
 *
 * <p>Thrown for empty input, malformed step syntax (unbalanced brackets or quotes, empty or illegal
 * step names, misplaced attribute segments) and unknown namespace prefixes. Callers processing a
 * catalog catch it per expression and skip the entry.
 */
public class ExpressionConversionException extends CdaFinderException {

  public ExpressionConversionException(String message) {
    super(CdaFinderErrorCode.CONVERSION_ERROR, message);
  }

  public ExpressionConversionException(String message, Throwable cause) {
    super(CdaFinderErrorCode.CONVERSION_ERROR, message, cause);
  }
}

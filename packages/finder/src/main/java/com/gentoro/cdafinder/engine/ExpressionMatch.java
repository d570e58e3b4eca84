package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.catalog.CatalogEntry;
import com.gentoro.cdafinder.expression.ConvertedExpression;
import java.util.List;

/**
 * Flat-mode result for one catalog entry.
 *
 * @param results at least one element; a single {@link MatchResult.NotFound} when nothing matched
 */
public record ExpressionMatch(
    CatalogEntry entry, ConvertedExpression expression, List<MatchResult> results) {

  public ExpressionMatch {
    results = List.copyOf(results);
  }

  public boolean found() {
    return results.stream().anyMatch(MatchResult::found);
  }
}

package com.gentoro.cdafinder.catalog;

import com.gentoro.cdafinder.expression.ConvertedExpression;
import com.gentoro.cdafinder.expression.ExpressionConversionException;
import com.gentoro.cdafinder.expression.ExpressionConverter;
import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/** Partitions catalog entries by the template identifier their expression is scoped to. */
public class CatalogGrouper {
  private static final Logger log = LoggingService.getLogger(CatalogGrouper.class);

  private final ExpressionConverter converter;

  public CatalogGrouper(ExpressionConverter converter) {
    this.converter = Objects.requireNonNull(converter, "converter");
  }

  /** Entries that fail conversion are logged and left out of both partitions. */
  public CatalogGroups group(List<CatalogEntry> entries) {
    Map<String, List<ConvertedEntry>> grouped = new LinkedHashMap<>();
    List<ConvertedEntry> ungrouped = new ArrayList<>();
    for (CatalogEntry entry : entries) {
      ConvertedExpression expression;
      try {
        expression = converter.convert(entry.expression());
      } catch (ExpressionConversionException e) {
        log.warn("Skipping catalog entry: {}", e.getMessage());
        continue;
      }
      ConvertedEntry converted = new ConvertedEntry(entry, expression);
      if (expression.hasTemplatePredicate()) {
        grouped
            .computeIfAbsent(expression.templateIdentifier(), id -> new ArrayList<>())
            .add(converted);
      } else {
        ungrouped.add(converted);
      }
    }
    log.debug(
        "Catalog grouped into {} template(s), {} ungrouped", grouped.size(), ungrouped.size());
    return new CatalogGroups(grouped, ungrouped);
  }
}

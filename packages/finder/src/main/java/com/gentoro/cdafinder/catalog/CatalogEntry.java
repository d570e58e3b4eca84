package com.gentoro.cdafinder.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One path expression of a catalog with its free-form metadata.
 *
 * <p>Metadata keys such as {@code context}, {@code template}, {@code cardinality} and {@code
 * dataElement} are optional and never validated.
 */
public record CatalogEntry(String expression, Map<String, String> metadata) {
  public static final String CONTEXT = "context";
  public static final String TEMPLATE = "template";
  public static final String CARDINALITY = "cardinality";

  public CatalogEntry {
    Objects.requireNonNull(expression, "expression");
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static CatalogEntry of(String expression) {
    return new CatalogEntry(expression, Map.of());
  }

  public String context() {
    return metadata.getOrDefault(CONTEXT, "");
  }

  public String template() {
    return metadata.getOrDefault(TEMPLATE, "");
  }

  public String cardinality() {
    return metadata.getOrDefault(CARDINALITY, "");
  }
}

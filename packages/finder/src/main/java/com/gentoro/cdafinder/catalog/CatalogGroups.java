package com.gentoro.cdafinder.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A catalog partitioned by template identifier.
 *
 * @param grouped identifier to entries carrying that template predicate, in first-seen order
 * @param ungrouped entries without a template predicate, in catalog order
 */
public record CatalogGroups(
    Map<String, List<ConvertedEntry>> grouped, List<ConvertedEntry> ungrouped) {
  public CatalogGroups {
    Map<String, List<ConvertedEntry>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<ConvertedEntry>> e : grouped.entrySet()) {
      copy.put(e.getKey(), List.copyOf(e.getValue()));
    }
    grouped = Collections.unmodifiableMap(copy);
    ungrouped = List.copyOf(ungrouped);
  }
}

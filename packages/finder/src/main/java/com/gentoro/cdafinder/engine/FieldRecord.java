package com.gentoro.cdafinder.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Field key to matches, for one template occurrence. Keys keep insertion order. */
public final class FieldRecord {
  private final Map<String, List<MatchResult>> fields = new LinkedHashMap<>();

  public void put(String key, List<MatchResult> matches) {
    if (matches.isEmpty()) return;
    fields.put(key, List.copyOf(matches));
  }

  public List<MatchResult> get(String key) {
    return fields.getOrDefault(key, List.of());
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  public int size() {
    return fields.size();
  }

  public Map<String, List<MatchResult>> asMap() {
    return Collections.unmodifiableMap(fields);
  }

  @Override
  public String toString() {
    return "FieldRecord" + fields.keySet();
  }
}

package com.gentoro.cdafinder.engine;

import java.util.List;

/**
 * Grouped results for one template identifier. Only occurrences with at least one field are
 * listed, so ordinals may have gaps.
 */
public record InstanceGroup(
    String templateIdentifier,
    String description,
    List<String> sourceExpressions,
    List<GroupedInstance> instances) {

  public InstanceGroup {
    sourceExpressions = List.copyOf(sourceExpressions);
    instances = List.copyOf(instances);
  }

  public int instanceCount() {
    return instances.size();
  }
}

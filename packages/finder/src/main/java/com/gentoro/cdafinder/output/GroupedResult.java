package com.gentoro.cdafinder.output;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/** Serializable view of an {@link com.gentoro.cdafinder.engine.InstanceGroup}. */
@JsonPropertyOrder({
  "templateIdentifier",
  "description",
  "sourceExpressions",
  "instanceCount",
  "instances"
})
public record GroupedResult(
    String templateIdentifier,
    String description,
    List<String> sourceExpressions,
    int instanceCount,
    List<Instance> instances) {

  @JsonPropertyOrder({"ordinal", "fields"})
  public record Instance(int ordinal, Map<String, List<GroupedEntry>> fields) {}
}

package com.gentoro.cdafinder.output;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Flat rows for ungrouped expressions next to the grouped results. */
@JsonPropertyOrder({"individualResults", "groupedResults", "summary"})
public record CombinedReport(
    List<FlatResult> individualResults, List<GroupedResult> groupedResults, Summary summary) {

  @JsonPropertyOrder({"individualMatches", "groupedInstances", "templateGroups"})
  public record Summary(int individualMatches, int groupedInstances, int templateGroups) {}

  public static CombinedReport of(List<FlatResult> individual, List<GroupedResult> grouped) {
    int matches = (int) individual.stream().filter(FlatResult::found).count();
    int instances = grouped.stream().mapToInt(GroupedResult::instanceCount).sum();
    return new CombinedReport(
        individual, grouped, new Summary(matches, instances, grouped.size()));
  }
}

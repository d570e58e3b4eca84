package com.gentoro.cdafinder.output;

import com.gentoro.cdafinder.catalog.CatalogEntry;
import com.gentoro.cdafinder.document.Node;
import com.gentoro.cdafinder.engine.ExpressionMatch;
import com.gentoro.cdafinder.engine.GroupedInstance;
import com.gentoro.cdafinder.engine.InstanceGroup;
import com.gentoro.cdafinder.engine.MatchResult;
import com.gentoro.cdafinder.engine.MatchResult.AttributeMatch;
import com.gentoro.cdafinder.engine.MatchResult.ElementMatch;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Maps engine results onto the serializable output records. */
public final class ResultMapper {
  private ResultMapper() {}

  public static List<FlatResult> toFlatResults(List<ExpressionMatch> matches) {
    List<FlatResult> rows = new ArrayList<>();
    for (ExpressionMatch match : matches) {
      for (MatchResult result : match.results()) {
        rows.add(toFlatResult(match, result));
      }
    }
    return rows;
  }

  static FlatResult toFlatResult(ExpressionMatch match, MatchResult result) {
    CatalogEntry entry = match.entry();
    String original = match.expression().original();
    String normalized = match.expression().normalizedPath();
    String dataElement = entry.metadata().getOrDefault("dataElement", "");

    if (result instanceof AttributeMatch a) {
      return new FlatResult(
          original,
          normalized,
          entry.context(),
          dataElement,
          entry.template(),
          entry.cardinality(),
          a.node().tag(),
          "@" + a.attributeName() + "=" + a.attributeValue(),
          a.node().attributes(),
          a.path(),
          true,
          true);
    }
    if (result instanceof ElementMatch e) {
      return new FlatResult(
          original,
          normalized,
          entry.context(),
          dataElement,
          entry.template(),
          entry.cardinality(),
          e.node().tag(),
          e.node().text(),
          e.node().attributes(),
          e.path(),
          true,
          false);
    }
    return new FlatResult(
        original,
        normalized,
        entry.context(),
        dataElement,
        entry.template(),
        entry.cardinality(),
        null,
        null,
        Map.of(),
        null,
        false,
        null);
  }

  public static List<GroupedResult> toGroupedResults(List<InstanceGroup> groups) {
    List<GroupedResult> out = new ArrayList<>(groups.size());
    for (InstanceGroup group : groups) out.add(toGroupedResult(group));
    return out;
  }

  public static GroupedResult toGroupedResult(InstanceGroup group) {
    List<GroupedResult.Instance> instances = new ArrayList<>();
    for (GroupedInstance instance : group.instances()) {
      Map<String, List<GroupedEntry>> fields = new LinkedHashMap<>();
      for (Map.Entry<String, List<MatchResult>> field : instance.fields().asMap().entrySet()) {
        List<GroupedEntry> entries = new ArrayList<>();
        for (MatchResult result : field.getValue()) {
          GroupedEntry entry = toGroupedEntry(result);
          if (entry != null) entries.add(entry);
        }
        fields.put(field.getKey(), entries);
      }
      instances.add(new GroupedResult.Instance(instance.ordinal(), fields));
    }
    return new GroupedResult(
        group.templateIdentifier(),
        group.description(),
        group.sourceExpressions(),
        group.instanceCount(),
        instances);
  }

  static GroupedEntry toGroupedEntry(MatchResult result) {
    if (result instanceof AttributeMatch a) {
      Node node = a.node();
      Map<String, String> only = new LinkedHashMap<>();
      only.put(a.attributeName(), a.attributeValue());
      return new GroupedEntry(
          node.tag(), null, only, a.path(), a.attributeName(), a.attributeValue());
    }
    if (result instanceof ElementMatch e) {
      return new GroupedEntry(
          e.node().tag(), e.node().text(), e.node().attributes(), e.path(), null, null);
    }
    return null;
  }
}

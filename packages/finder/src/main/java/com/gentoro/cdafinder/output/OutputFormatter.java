package com.gentoro.cdafinder.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gentoro.cdafinder.exception.OutputException;
import com.gentoro.cdafinder.logging.LoggingService;
import com.gentoro.cdafinder.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/** Renders flat, grouped and combined results as JSON, CSV or text. */
public class OutputFormatter {
  private static final Logger log = LoggingService.getLogger(OutputFormatter.class);

  private static final String RULE = "=".repeat(50);
  private static final Set<String> HIGHLIGHTED = Set.of("displayName", "code", "value");
  private static final Set<String> HIGHLIGHTED_GROUPED =
      Set.of("displayName", "code", "value", "codeSystemName");

  private static final Set<String> COMBINED_KINDS = Set.of("displayName", "codeSystemName");

  private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper json = JacksonUtility.getJsonMapper();
  private final CsvMapper csv = JacksonUtility.getCsvMapper();
  private final int maxNotFound;

  public OutputFormatter(int maxNotFound) {
    this.maxNotFound = maxNotFound;
  }

  public OutputFormatter() {
    this(10);
  }

  public String formatFlat(List<FlatResult> rows, OutputFormat format) {
    return switch (format) {
      case JSON -> toJson(rows);
      case CSV -> toCsv(rows);
      case TEXT -> flatText(rows);
    };
  }

  public String formatGrouped(List<GroupedResult> groups, OutputFormat format) {
    return switch (format) {
      case JSON -> toJson(groups);
      case CSV -> toCsv(groupedRows(groups));
      case TEXT -> groupedText(groups);
    };
  }

  public String formatCombined(CombinedReport report, OutputFormat format) {
    return switch (format) {
      case JSON -> toJson(report);
      case CSV ->
          toCsv(report.individualResults())
              + System.lineSeparator()
              + toCsv(groupedRows(report.groupedResults()));
      case TEXT -> combinedText(report);
    };
  }

  /** Writes {@code content} to {@code file} as UTF-8, creating parent directories. */
  public void write(String content, Path file) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(file, content, StandardCharsets.UTF_8);
      log.info("Results written to {}", file);
    } catch (IOException e) {
      throw new OutputException("Unable to write results to " + file + ": " + e.getMessage(), e);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // JSON / CSV
  // ---------------------------------------------------------------------------------------------

  private String toJson(Object value) {
    try {
      return json.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new OutputException("Unable to serialize results as JSON", e);
    }
  }

  /** Header is the sorted union of all row keys; nested values are written as JSON. */
  private String toCsv(List<?> rows) {
    if (rows.isEmpty()) return "";
    List<Map<String, Object>> maps = new ArrayList<>(rows.size());
    Set<String> columns = new TreeSet<>();
    for (Object row : rows) {
      Map<String, Object> map = json.convertValue(row, ROW_TYPE);
      columns.addAll(map.keySet());
      maps.add(map);
    }

    CsvSchema.Builder schema = CsvSchema.builder();
    for (String column : columns) schema.addColumn(column);

    List<Map<String, String>> cells = new ArrayList<>(maps.size());
    for (Map<String, Object> map : maps) {
      Map<String, String> line = new LinkedHashMap<>();
      for (String column : columns) line.put(column, cell(map.get(column)));
      cells.add(line);
    }
    try {
      return csv.writer(schema.build().withHeader()).writeValueAsString(cells);
    } catch (JsonProcessingException e) {
      throw new OutputException("Unable to serialize results as CSV", e);
    }
  }

  private String cell(Object value) {
    if (value == null) return "";
    if (value instanceof Map || value instanceof List) {
      return toJson(value).replaceAll("\\s*\\R\\s*", " ");
    }
    return String.valueOf(value);
  }

  private static List<Map<String, Object>> groupedRows(List<GroupedResult> groups) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (GroupedResult group : groups) {
      for (GroupedResult.Instance instance : group.instances()) {
        for (Map.Entry<String, List<GroupedEntry>> field : instance.fields().entrySet()) {
          for (GroupedEntry entry : field.getValue()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("templateIdentifier", group.templateIdentifier());
            row.put("description", group.description());
            row.put("ordinal", instance.ordinal());
            row.put("field", field.getKey());
            row.put("tag", entry.tag());
            row.put("text", entry.text());
            row.put("attributes", entry.attributes());
            row.put("path", entry.path());
            row.put("attributeName", entry.attributeName());
            row.put("attributeValue", entry.attributeValue());
            rows.add(row);
          }
        }
      }
    }
    return rows;
  }

  // ---------------------------------------------------------------------------------------------
  // Text
  // ---------------------------------------------------------------------------------------------

  private String flatText(List<FlatResult> rows) {
    List<FlatResult> found = rows.stream().filter(FlatResult::found).toList();
    List<FlatResult> missing = rows.stream().filter(r -> !r.found()).toList();

    StringBuilder sb = new StringBuilder();
    line(sb, "CDA Element Analysis Results");
    line(sb, RULE);
    line(sb, "Total expressions processed: " + rows.size());
    line(sb, "Elements found: " + found.size());
    line(sb, "Elements not found: " + missing.size());
    line(sb, "");

    if (!found.isEmpty()) {
      line(sb, "FOUND ELEMENTS:");
      line(sb, "-".repeat(30));
      for (FlatResult row : found) {
        line(sb, "Expression: " + row.originalExpression());
        line(sb, "  Element: " + row.matchedTag());
        line(sb, "  Text: " + row.matchedText());
        Map<String, String> attrs = row.matchedAttributes();
        if (attrs == null || attrs.isEmpty()) {
          line(sb, "  Attributes: {}");
        } else {
          if (attrs.containsKey("displayName")) {
            line(sb, "  DisplayName: " + attrs.get("displayName"));
          }
          if (attrs.containsKey("code")) line(sb, "  Code: " + attrs.get("code"));
          if (attrs.containsKey("value")) line(sb, "  Value: " + attrs.get("value"));
          Map<String, String> other = others(attrs, HIGHLIGHTED);
          if (!other.isEmpty()) line(sb, "  Other Attributes: " + other);
        }
        line(sb, "");
      }
    }

    if (!missing.isEmpty()) {
      line(sb, "NOT FOUND ELEMENTS:");
      line(sb, "-".repeat(30));
      for (FlatResult row : missing.subList(0, Math.min(maxNotFound, missing.size()))) {
        line(sb, "Expression: " + row.originalExpression());
        line(sb, "");
      }
      if (missing.size() > maxNotFound) {
        line(sb, "... and " + (missing.size() - maxNotFound) + " more");
      }
    }
    return sb.toString();
  }

  private String groupedText(List<GroupedResult> groups) {
    StringBuilder sb = new StringBuilder();
    line(sb, "CDA Grouped Element Analysis Results");
    line(sb, RULE);
    line(sb, "Total template groups: " + groups.size());
    int instances = groups.stream().mapToInt(GroupedResult::instanceCount).sum();
    line(sb, "Total instances found: " + instances);
    line(sb, "");

    for (GroupedResult group : groups) {
      line(sb, "Template: " + group.description());
      line(sb, "Template ID: " + group.templateIdentifier());
      line(sb, "Instances: " + group.instanceCount());
      if (!group.sourceExpressions().isEmpty()) {
        line(sb, "Expressions:");
        for (String expression : group.sourceExpressions()) line(sb, "  - " + expression);
      }
      line(sb, "-".repeat(40));
      for (GroupedResult.Instance instance : group.instances()) {
        line(sb, "Instance " + instance.ordinal() + ":");
        for (Map.Entry<String, Map<String, List<GroupedEntry>>> base :
            relatedFields(instance.fields()).entrySet()) {
          line(sb, "  " + base.getKey() + ":");
          for (String text : combineRelated(base.getValue())) line(sb, "    " + text);
        }
        line(sb, "");
      }
      line(sb, "");
    }
    return sb.toString();
  }

  private String combinedText(CombinedReport report) {
    StringBuilder sb = new StringBuilder();
    line(sb, "INDIVIDUAL RESULTS");
    line(sb, RULE);
    sb.append(flatText(report.individualResults()));
    line(sb, "");
    line(sb, "GROUPED RESULTS");
    line(sb, RULE);
    sb.append(groupedText(report.groupedResults()));
    CombinedReport.Summary summary = report.summary();
    line(
        sb,
        "Summary: %d individual match(es), %d grouped instance(s) across %d template group(s)"
            .formatted(
                summary.individualMatches(), summary.groupedInstances(), summary.templateGroups()));
    return sb.toString();
  }

  /**
   * Buckets field keys by their base ({@code code/code} and {@code code/displayName} both under
   * {@code code}). A key without {@code /} is its own base with the kind {@code value}.
   */
  static Map<String, Map<String, List<GroupedEntry>>> relatedFields(
      Map<String, List<GroupedEntry>> fields) {
    Map<String, Map<String, List<GroupedEntry>>> out = new LinkedHashMap<>();
    for (Map.Entry<String, List<GroupedEntry>> field : fields.entrySet()) {
      String key = field.getKey();
      int slash = key.lastIndexOf('/');
      String base = slash < 0 ? key : key.substring(0, slash);
      String kind = slash < 0 ? "value" : key.substring(slash + 1);
      out.computeIfAbsent(base, b -> new LinkedHashMap<>()).put(kind, field.getValue());
    }
    return out;
  }

  /**
   * One line per value of the primary kind ({@code code}, else {@code value}), with the
   * display name and code system at the same position joined onto it. Other kinds follow on their
   * own lines.
   */
  static List<String> combineRelated(Map<String, List<GroupedEntry>> kinds) {
    List<String> lines = new ArrayList<>();
    String primary =
        kinds.containsKey("code") ? "code" : kinds.containsKey("value") ? "value" : null;
    if (primary == null) {
      for (List<GroupedEntry> entries : kinds.values()) {
        for (GroupedEntry entry : entries) lines.addAll(describe(entry));
      }
      return lines;
    }

    List<GroupedEntry> primaries = kinds.get(primary);
    List<GroupedEntry> names = kinds.getOrDefault("displayName", List.of());
    List<GroupedEntry> systems = kinds.getOrDefault("codeSystemName", List.of());
    for (int i = 0; i < primaries.size(); i++) {
      GroupedEntry entry = primaries.get(i);
      if (!entry.isAttribute()) {
        lines.addAll(describe(entry));
        continue;
      }
      List<String> parts = new ArrayList<>();
      parts.add(StringUtils.capitalize(primary) + ": " + entry.attributeValue());
      if (i < names.size()) parts.add("DisplayName: " + related(names.get(i), "displayName"));
      if (i < systems.size()) parts.add("System: " + related(systems.get(i), "codeSystemName"));
      lines.add(String.join(" | ", parts));
    }
    for (int i = primaries.size(); i < names.size(); i++) lines.addAll(describe(names.get(i)));
    for (int i = primaries.size(); i < systems.size(); i++) lines.addAll(describe(systems.get(i)));
    for (Map.Entry<String, List<GroupedEntry>> kind : kinds.entrySet()) {
      if (COMBINED_KINDS.contains(kind.getKey()) || kind.getKey().equals(primary)) continue;
      for (GroupedEntry entry : kind.getValue()) lines.addAll(describe(entry));
    }
    return lines;
  }

  private static String related(GroupedEntry entry, String attribute) {
    if (entry.isAttribute()) return entry.attributeValue();
    return entry.attributes() == null ? "" : entry.attributes().getOrDefault(attribute, "");
  }

  private static List<String> describe(GroupedEntry entry) {
    List<String> lines = new ArrayList<>();
    if (entry.isAttribute()) {
      lines.add(entry.attributeName() + ": " + entry.attributeValue());
      return lines;
    }
    if (StringUtils.isNotEmpty(entry.text())) lines.add("Text: " + entry.text());
    Map<String, String> attrs = entry.attributes();
    if (attrs != null && !attrs.isEmpty()) {
      List<String> parts = new ArrayList<>();
      if (attrs.containsKey("code")) parts.add("Code: " + attrs.get("code"));
      if (attrs.containsKey("displayName")) parts.add("DisplayName: " + attrs.get("displayName"));
      if (attrs.containsKey("codeSystemName")) parts.add("System: " + attrs.get("codeSystemName"));
      if (attrs.containsKey("value")) parts.add("Value: " + attrs.get("value"));
      if (!parts.isEmpty()) lines.add(String.join(" | ", parts));
      Map<String, String> other = others(attrs, HIGHLIGHTED_GROUPED);
      if (!other.isEmpty()) lines.add("Other Attributes: " + other);
    }
    return lines;
  }

  private static Map<String, String> others(Map<String, String> attrs, Set<String> skip) {
    Map<String, String> other = new LinkedHashMap<>(attrs);
    other.keySet().removeAll(skip);
    return other;
  }

  private static void line(StringBuilder sb, String text) {
    sb.append(text).append(System.lineSeparator());
  }
}

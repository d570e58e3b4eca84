package com.gentoro.cdafinder.output;

import static com.gentoro.cdafinder.TestDocuments.PROBLEM;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.cdafinder.TestDocuments;
import com.gentoro.cdafinder.catalog.CatalogEntry;
import com.gentoro.cdafinder.config.FinderSettings;
import com.gentoro.cdafinder.document.CdaDocument;
import com.gentoro.cdafinder.engine.CdaElementFinder;
import com.gentoro.cdafinder.exception.OutputException;
import com.gentoro.cdafinder.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputFormatterTest {

  private static final String NL = System.lineSeparator();
  private static final String SCOPE = "observation[templateId[@root='" + PROBLEM + "']]";

  private final CdaElementFinder finder = CdaElementFinder.create(FinderSettings.defaults());
  private final OutputFormatter formatter = new OutputFormatter();

  private List<FlatResult> flat;
  private List<GroupedResult> grouped;

  @BeforeEach
  void setUp() {
    CdaDocument doc = TestDocuments.sample();
    List<CatalogEntry> entries =
        List.of(
            new CatalogEntry(
                "ClinicalDocument/effectiveTime/@value",
                Map.of(CatalogEntry.CONTEXT, "Header", CatalogEntry.CARDINALITY, "1..1")),
            CatalogEntry.of("ClinicalDocument/title"),
            CatalogEntry.of("section/missing/@code"));
    flat = ResultMapper.toFlatResults(finder.findElements(doc, entries));
    grouped =
        ResultMapper.toGroupedResults(
            finder.findGrouped(
                doc,
                List.of(
                    CatalogEntry.of(SCOPE + "/code/@code"),
                    CatalogEntry.of(SCOPE + "/code/@displayName"),
                    CatalogEntry.of(SCOPE + "/code/@codeSystemName"))));
  }

  private static JsonNode readJson(String json) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(json);
  }

  @Test
  @DisplayName("flat JSON keeps field order and omits isAttribute on not-found rows")
  void flatJson() throws Exception {
    JsonNode rows = readJson(formatter.formatFlat(flat, OutputFormat.JSON));
    assertEquals(3, rows.size());

    JsonNode time = rows.get(0);
    assertEquals("originalExpression", time.fieldNames().next());
    assertEquals("Header", time.get("context").asText());
    assertEquals("1..1", time.get("cardinality").asText());
    assertEquals("@value=20240115103000-0500", time.get("matchedText").asText());
    assertEquals("{urn:hl7-org:v3}effectiveTime", time.get("matchedTag").asText());
    assertEquals("/ClinicalDocument/effectiveTime/@value", time.get("matchedPath").asText());
    assertTrue(time.get("isAttribute").asBoolean());

    JsonNode title = rows.get(1);
    assertEquals("Initial Public Health Case Report", title.get("matchedText").asText());
    assertFalse(title.get("isAttribute").asBoolean());

    JsonNode missing = rows.get(2);
    assertFalse(missing.get("found").asBoolean());
    assertFalse(missing.has("isAttribute"));
    assertTrue(missing.get("matchedTag").isNull());
    assertEquals(0, missing.get("matchedAttributes").size());
    assertEquals("section/missing/@code", missing.get("originalExpression").asText());
  }

  @Test
  @DisplayName("CSV header is the sorted union of row keys")
  void flatCsv() {
    String csv = formatter.formatFlat(flat, OutputFormat.CSV);
    String header = csv.lines().findFirst().orElseThrow();
    assertEquals(
        "cardinality,context,dataElement,found,isAttribute,matchedAttributes,matchedPath,"
            + "matchedTag,matchedText,normalizedPath,originalExpression,template",
        header);
    assertEquals(4, csv.lines().count());
    assertEquals("", formatter.formatFlat(List.of(), OutputFormat.CSV));
  }

  @Test
  void flatText() {
    String text = formatter.formatFlat(flat, OutputFormat.TEXT);
    assertTrue(text.startsWith("CDA Element Analysis Results" + NL));
    assertTrue(text.contains("Total expressions processed: 3" + NL));
    assertTrue(text.contains("Elements found: 2" + NL));
    assertTrue(text.contains("Elements not found: 1" + NL));
    assertTrue(text.contains("Expression: ClinicalDocument/effectiveTime/@value" + NL));
    assertTrue(text.contains("  Value: 20240115103000-0500" + NL));
    assertTrue(text.contains("  Text: Initial Public Health Case Report" + NL));
    assertTrue(text.contains("NOT FOUND ELEMENTS:"));
    assertTrue(text.contains("Expression: section/missing/@code" + NL));
  }

  @Test
  @DisplayName("text output lists a bounded number of unmatched expressions")
  void notFoundLimit() {
    List<FlatResult> rows = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      rows.add(
          new FlatResult(
              "missing/" + i,
              "./missing",
              "",
              "",
              "",
              "",
              null,
              null,
              Map.of(),
              null,
              false,
              null));
    }
    String text = new OutputFormatter(1).formatFlat(rows, OutputFormat.TEXT);
    assertTrue(text.contains("Expression: missing/0"));
    assertFalse(text.contains("Expression: missing/1"));
    assertTrue(text.contains("... and 3 more"));
  }

  @Test
  @DisplayName("grouped JSON nests fields per instance")
  void groupedJson() throws Exception {
    JsonNode groups = readJson(formatter.formatGrouped(grouped, OutputFormat.JSON));
    assertEquals(1, groups.size());
    JsonNode group = groups.get(0);
    assertEquals(PROBLEM, group.get("templateIdentifier").asText());
    assertEquals("Problem Observation", group.get("description").asText());
    assertEquals(2, group.get("instanceCount").asInt());

    JsonNode code = group.get("instances").get(0).get("fields").get("code/code").get(0);
    assertEquals("code", code.get("attributeName").asText());
    assertEquals("A", code.get("attributeValue").asText());
    assertEquals(1, code.get("attributes").size());
    assertFalse(code.has("text"));
    assertFalse(code.has("isAttribute"));
  }

  @Test
  @DisplayName("grouped text joins related code, display name and code system")
  void groupedText() {
    String text = formatter.formatGrouped(grouped, OutputFormat.TEXT);
    assertTrue(text.startsWith("CDA Grouped Element Analysis Results" + NL));
    assertTrue(text.contains("Total template groups: 1" + NL));
    assertTrue(text.contains("Total instances found: 2" + NL));
    assertTrue(text.contains("Template: Problem Observation" + NL));
    assertTrue(text.contains("Template ID: " + PROBLEM + NL));
    assertTrue(text.contains("Instance 1:" + NL));
    assertTrue(text.contains("Code: A | DisplayName: Problem A | System: SNOMED CT" + NL));
    assertTrue(text.contains("Code: B | DisplayName: Problem B | System: SNOMED CT" + NL));
  }

  @Test
  void groupedCsvHasOneRowPerValue() {
    String csv = formatter.formatGrouped(grouped, OutputFormat.CSV);
    assertEquals(7, csv.lines().count());
    assertTrue(csv.lines().findFirst().orElseThrow().startsWith("attributeName,attributeValue,"));
  }

  @Test
  @DisplayName("related fields are bucketed by their base key")
  void relatedFields() {
    GroupedEntry height =
        new GroupedEntry("value", null, Map.of("value", "170"), "/v/@value", "value", "170");
    GroupedEntry unit =
        new GroupedEntry("value", null, Map.of("unit", "cm"), "/v/@unit", "unit", "cm");
    Map<String, List<GroupedEntry>> fields = new LinkedHashMap<>();
    fields.put("value/value", List.of(height));
    fields.put("value/unit", List.of(unit));
    fields.put("title", List.of(new GroupedEntry("t", "Vitals", Map.of(), "/t", null, null)));

    Map<String, Map<String, List<GroupedEntry>>> related = OutputFormatter.relatedFields(fields);
    assertEquals(List.of("value", "title"), List.copyOf(related.keySet()));
    assertEquals(
        List.of("Value: 170", "unit: cm"), OutputFormatter.combineRelated(related.get("value")));
    assertEquals(List.of("Text: Vitals"), OutputFormatter.combineRelated(related.get("title")));
  }

  @Test
  void combinedReport() throws Exception {
    CombinedReport report = CombinedReport.of(flat, grouped);
    assertEquals(2, report.summary().individualMatches());
    assertEquals(2, report.summary().groupedInstances());
    assertEquals(1, report.summary().templateGroups());

    JsonNode json = readJson(formatter.formatCombined(report, OutputFormat.JSON));
    Iterator<String> names = json.fieldNames();
    assertEquals("individualResults", names.next());
    assertEquals("groupedResults", names.next());
    assertEquals("summary", names.next());

    String text = formatter.formatCombined(report, OutputFormat.TEXT);
    assertTrue(text.startsWith("INDIVIDUAL RESULTS" + NL));
    assertTrue(text.contains("GROUPED RESULTS" + NL));
    assertTrue(
        text.contains(
            "Summary: 2 individual match(es), 2 grouped instance(s) across 1 template group(s)"));

    String csv = formatter.formatCombined(report, OutputFormat.CSV);
    assertTrue(csv.contains(NL + "attributeName,attributeValue,"));
  }

  @Test
  void writesFileCreatingParents(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("nested/out/results.json");
    formatter.write("[]", file);
    assertEquals("[]", Files.readString(file));
  }

  @Test
  void writeFailureIsReported(@TempDir Path dir) throws Exception {
    Path blocker = dir.resolve("blocker");
    Files.writeString(blocker, "x");
    assertThrows(OutputException.class, () -> formatter.write("[]", blocker.resolve("out.json")));
  }

  @Test
  void formatNames() {
    assertEquals(OutputFormat.TEXT, OutputFormat.fromName(" Text "));
    assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromName("xml"));
  }
}

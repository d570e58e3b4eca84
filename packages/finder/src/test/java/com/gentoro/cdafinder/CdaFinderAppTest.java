package com.gentoro.cdafinder;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.cdafinder.utility.JacksonUtility;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CdaFinderAppTest {

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private CdaFinderApp app;

  private final String document = TestDocuments.resource(TestDocuments.SAMPLE).toString();
  private final String catalog = TestDocuments.resource("catalog/problems.yaml").toString();

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    app =
        new CdaFinderApp(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("flat JSON goes to standard output")
  void flatJson() throws Exception {
    assertEquals(0, app.run(new String[] {document, "--catalog", catalog}));
    JsonNode rows = JacksonUtility.getJsonMapper().readTree(out());
    assertEquals(8, rows.size());
    assertEquals("", err());
  }

  @Test
  void autoGroupText() {
    assertEquals(0, app.run(new String[] {document, "-c", catalog, "--auto-group", "-f", "text"}));
    String text = out();
    assertTrue(text.startsWith("CDA Grouped Element Analysis Results"));
    assertTrue(text.contains("Template: Problem Observation"));
    assertTrue(text.contains("Template: Vital Signs Observation"));
  }

  @Test
  @DisplayName("show-both renders ungrouped expressions individually")
  void showBoth() throws Exception {
    assertEquals(0, app.run(new String[] {document, "-c", catalog, "--show-both"}));
    JsonNode report = JacksonUtility.getJsonMapper().readTree(out());
    assertEquals(2, report.get("individualResults").size());
    assertEquals(2, report.get("groupedResults").size());
    assertEquals(2, report.get("summary").get("templateGroups").asInt());
  }

  @Test
  void referenceFile() throws Exception {
    String ref = TestDocuments.resource("catalog/reference.txt").toString();
    assertEquals(0, app.run(new String[] {document, "--xpath-ref", ref}));
    assertEquals(4, JacksonUtility.getJsonMapper().readTree(out()).size());
  }

  @Test
  void writesOutputFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("out/results.csv");
    assertEquals(
        0,
        app.run(new String[] {document, "-c", catalog, "-f", "csv", "-o", file.toString()}));
    assertEquals("Results saved to: " + file, out().strip());
    assertTrue(Files.readString(file).startsWith("cardinality,context,"));
  }

  @Test
  @DisplayName("configuration file changes the default format")
  void configFile(@TempDir Path dir) throws Exception {
    Path config = dir.resolve("finder.yaml");
    Files.writeString(config, "output:\n  format: text\n");
    assertEquals(0, app.run(new String[] {document, "-c", catalog, "--config", config.toString()}));
    assertTrue(out().startsWith("CDA Element Analysis Results"));
  }

  @Test
  void help() {
    assertEquals(0, app.run(new String[] {"--help"}));
    assertTrue(out().contains("usage: cda-finder"));
  }

  @Test
  void missingDocumentArgument() {
    assertEquals(1, app.run(new String[] {"-c", catalog}));
    assertTrue(err().contains("Exactly one CDA document is required"));
  }

  @Test
  void unknownOption() {
    assertEquals(1, app.run(new String[] {document, "--bogus"}));
    assertTrue(err().startsWith("Parse of command-line failed: "));
  }

  @Test
  void unsupportedFormat() {
    assertEquals(1, app.run(new String[] {document, "-f", "xml"}));
    assertTrue(err().contains("Unsupported output format 'xml'"));
  }

  @Test
  @DisplayName("failures are reported on standard error with exit code 1")
  void missingDocument(@TempDir Path dir) {
    Path missing = dir.resolve("missing.xml");
    assertEquals(1, app.run(new String[] {missing.toString(), "-c", catalog}));
    assertEquals("Error: XML file not found: " + missing, err().strip());
  }
}

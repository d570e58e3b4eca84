package com.gentoro.cdafinder;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.cdafinder.catalog.CatalogEntry;
import com.gentoro.cdafinder.config.FinderSettings;
import com.gentoro.cdafinder.exception.DocumentParseException;
import com.gentoro.cdafinder.output.OutputFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CdaFinderTest {

  private final CdaFinder cdaFinder = new CdaFinder(FinderSettings.defaults());
  private final Path document = TestDocuments.resource(TestDocuments.SAMPLE);
  private final Path yaml = TestDocuments.resource("catalog/problems.yaml");
  private final Path reference = TestDocuments.resource("catalog/reference.txt");

  private CdaFinder.Request request(Path catalog, Path ref, Path output, boolean group) {
    return new CdaFinder.Request(document, catalog, ref, output, OutputFormat.TEXT, group, false);
  }

  @Test
  @DisplayName("catalog entries come first, then mined reference entries")
  void catalogThenReference() {
    List<CatalogEntry> entries = cdaFinder.catalog(request(yaml, reference, null, false));
    assertEquals(8, entries.size());
    assertEquals("Patient", entries.get(1).context());
    assertEquals("1..1", entries.get(5).cardinality());
  }

  @Test
  @DisplayName("the built-in reference is used when no catalog is given")
  void builtInReference() {
    List<CatalogEntry> entries = cdaFinder.catalog(request(null, null, null, false));
    assertEquals(6, entries.size());
    assertEquals("ClinicalDocument/effectiveTime/@value", entries.get(0).expression());
  }

  @Test
  void flatRun() {
    String text = cdaFinder.run(request(yaml, null, null, false));
    assertTrue(text.contains("Total expressions processed: 8"));
    assertTrue(text.contains("Elements found: 8"));
  }

  @Test
  void groupedRunWritesOutput(@TempDir Path dir) throws Exception {
    Path out = dir.resolve("grouped.txt");
    String text = cdaFinder.run(request(yaml, null, out, true));
    assertTrue(text.contains("Template: Vital Signs Observation"));
    assertEquals(text, Files.readString(out));
  }

  @Test
  void missingDocument(@TempDir Path dir) {
    CdaFinder.Request missing =
        new CdaFinder.Request(
            dir.resolve("none.xml"), yaml, null, null, OutputFormat.JSON, false, false);
    assertThrows(DocumentParseException.class, () -> cdaFinder.run(missing));
  }
}

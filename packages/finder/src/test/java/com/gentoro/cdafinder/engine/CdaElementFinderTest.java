package com.gentoro.cdafinder.engine;

import static com.gentoro.cdafinder.TestDocuments.PROBLEM;
import static com.gentoro.cdafinder.TestDocuments.VITAL_SIGN;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.cdafinder.TestDocuments;
import com.gentoro.cdafinder.catalog.CatalogEntry;
import com.gentoro.cdafinder.catalog.CatalogGroups;
import com.gentoro.cdafinder.config.FinderSettings;
import com.gentoro.cdafinder.document.CdaDocument;
import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.expression.ExpressionConversionException;
import com.gentoro.cdafinder.expression.ExpressionConverter;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CdaElementFinderTest {

  private static final String PROBLEM_CODE =
      "observation[templateId[@root='" + PROBLEM + "']]/code/@code";
  private static final String PROBLEM_NAME =
      "observation[templateId[@root='" + PROBLEM + "']]/code/@displayName";
  private static final String VITAL_VALUE =
      "observation[templateId[@root='" + VITAL_SIGN + "']]/value/@value";
  private static final String EFFECTIVE_TIME = "ClinicalDocument/effectiveTime/@value";

  private final CdaElementFinder finder = CdaElementFinder.create(FinderSettings.defaults());
  private final CdaDocument doc = TestDocuments.sample();

  private static List<CatalogEntry> entries(String... expressions) {
    return Arrays.stream(expressions).map(CatalogEntry::of).toList();
  }

  @Test
  @DisplayName("flat mode reports one match list per entry, in catalog order")
  void flatMode() {
    List<ExpressionMatch> matches =
        finder.findElements(doc, entries(PROBLEM_CODE, EFFECTIVE_TIME, "section/nothing/@code"));
    assertEquals(3, matches.size());
    assertEquals(2, matches.get(0).results().size());
    assertEquals(PROBLEM_CODE, matches.get(0).expression().original());
    assertTrue(matches.get(1).found());
    assertEquals(
        "20240115103000-0500",
        ((MatchResult.AttributeMatch) matches.get(1).results().get(0)).attributeValue());
    assertFalse(matches.get(2).found());
  }

  @Test
  @DisplayName("entries that fail conversion are skipped, the rest still run")
  void conversionFailureSkipsEntry() {
    ExpressionConverter real = new ExpressionConverter();
    ExpressionConverter converter = mock(ExpressionConverter.class);
    when(converter.convert("broken/@x"))
        .thenThrow(new ExpressionConversionException("Malformed path expression 'broken/@x'"));
    when(converter.convert(EFFECTIVE_TIME)).thenReturn(real.convert(EFFECTIVE_TIME));

    TemplateLocator locator = new TemplateLocator(NamespaceTable.cda());
    TreeMatcher matcher = new TreeMatcher(locator);
    InstanceGrouper grouper =
        new InstanceGrouper(
            matcher,
            locator,
            new ScopeBoundaryResolver(NamespaceTable.cda()),
            new FieldNamer(),
            new TemplateDescriptions());
    CdaElementFinder mocked = new CdaElementFinder(converter, matcher, grouper);

    List<ExpressionMatch> matches = mocked.findElements(doc, entries("broken/@x", EFFECTIVE_TIME));
    assertEquals(1, matches.size());
    assertEquals(EFFECTIVE_TIME, matches.get(0).entry().expression());
    verify(converter).convert("broken/@x");
  }

  @Test
  void malformedEntryIsSkipped() {
    List<ExpressionMatch> matches = finder.findElements(doc, entries("code", EFFECTIVE_TIME));
    assertEquals(1, matches.size());
  }

  @Test
  @DisplayName("catalog partitions by template identifier in first-seen order")
  void catalogPartition() {
    CatalogGroups groups =
        finder.groupCatalog(
            entries(VITAL_VALUE, EFFECTIVE_TIME, PROBLEM_CODE, "bad[", PROBLEM_NAME));
    assertEquals(List.of(VITAL_SIGN, PROBLEM), List.copyOf(groups.grouped().keySet()));
    assertEquals(2, groups.grouped().get(PROBLEM).size());
    assertEquals(1, groups.ungrouped().size());
    assertEquals(EFFECTIVE_TIME, groups.ungrouped().get(0).entry().expression());
  }

  @Test
  @DisplayName("auto grouping keeps only templates with data and never groups ungrouped entries")
  void autoGrouping() {
    String absent = "observation[templateId[@root='1.2.3']]/code/@code";
    List<InstanceGroup> groups =
        finder.findGrouped(doc, entries(PROBLEM_CODE, EFFECTIVE_TIME, absent, VITAL_VALUE));
    assertEquals(2, groups.size());
    assertEquals(PROBLEM, groups.get(0).templateIdentifier());
    assertEquals(VITAL_SIGN, groups.get(1).templateIdentifier());
    assertEquals(2, groups.get(1).instanceCount());
  }

  @Test
  void singleGroup() {
    InstanceGroup group = finder.findGroup(doc, PROBLEM, entries(PROBLEM_CODE, PROBLEM_NAME));
    assertEquals(2, group.instanceCount());
    assertEquals(List.of(PROBLEM_CODE, PROBLEM_NAME), group.sourceExpressions());
  }
}

package com.gentoro.cdafinder.engine;

import static com.gentoro.cdafinder.TestDocuments.PROBLEM;
import static com.gentoro.cdafinder.TestDocuments.PROBLEM_STATUS;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.cdafinder.TestDocuments;
import com.gentoro.cdafinder.document.CdaDocument;
import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.document.Node;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScopeBoundaryResolverTest {

  private static final String NS = NamespaceTable.CDA_NAMESPACE;

  private final TemplateLocator locator = new TemplateLocator(NamespaceTable.cda());
  private final ScopeBoundaryResolver resolver = new ScopeBoundaryResolver(NamespaceTable.cda());

  private CdaDocument doc;
  private TemplateInstance problemA;
  private Node ownCode;
  private Node nestedCode;

  @BeforeEach
  void setUp() {
    doc = TestDocuments.sample();
    problemA = locator.locate(doc.root(), PROBLEM).get(0);
    ownCode = problemA.root().children(NS, "code").get(0);
    Node status = locator.locate(doc.root(), PROBLEM_STATUS).get(0).root();
    nestedCode = status.children(NS, "code").get(0);
  }

  @Test
  void ownElementsAreIncluded() {
    assertTrue(resolver.includes(problemA, ownCode));
    assertTrue(resolver.includes(problemA, problemA.root()));
    assertEquals("A", ownCode.attribute("code"));
  }

  @Test
  @DisplayName("elements of a nested template occurrence are excluded")
  void nestedTemplateExcluded() {
    assertEquals("33999-4", nestedCode.attribute("code"));
    assertFalse(resolver.includes(problemA, nestedCode));
  }

  @Test
  @DisplayName("a node outside the occurrence is a programming error")
  void outsideNodeRejected() {
    Node title = doc.root().children(NS, "title").get(0);
    assertThrows(IllegalStateException.class, () -> resolver.includes(problemA, title));

    Node foreign = TestDocuments.sample().root();
    assertThrows(IllegalStateException.class, () -> resolver.includes(problemA, foreign));
  }

  @Test
  void filterKeepsOnlyOwnMatches() {
    List<MatchResult> filtered =
        resolver.filter(
            problemA,
            List.of(
                MatchResult.attribute(ownCode, "code"),
                MatchResult.attribute(nestedCode, "code"),
                MatchResult.notFound("x/@y")));
    assertEquals(List.of(MatchResult.attribute(ownCode, "code")), filtered);
  }

  @Test
  @DisplayName("an intervening marker with the same identifier does not exclude")
  void sameIdentifierDoesNotExclude() {
    CdaDocument nested =
        TestDocuments.cda(
            "<act><templateId root=\"X\"/><entryRelationship><act><templateId root=\"X\"/>"
                + "<code code=\"inner\"/></act></entryRelationship></act>");
    TemplateInstance outer = locator.locate(nested.root(), "X").get(0);
    Node inner =
        nested.nodes().stream()
            .filter(n -> "inner".equals(n.attribute("code")))
            .findFirst()
            .orElseThrow();
    assertTrue(resolver.includes(outer, inner));
  }
}

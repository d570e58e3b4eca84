package com.gentoro.cdafinder.engine;

import static com.gentoro.cdafinder.TestDocuments.VITAL_SIGN;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.cdafinder.TestDocuments;
import com.gentoro.cdafinder.document.CdaDocument;
import com.gentoro.cdafinder.document.NamespaceTable;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TemplateLocatorTest {

  private final TemplateLocator locator = new TemplateLocator(NamespaceTable.cda());
  private final CdaDocument doc = TestDocuments.sample();

  @Test
  @DisplayName("occurrences are numbered from 1 in document order")
  void ordinals() {
    List<TemplateInstance> vitals = locator.locate(doc.root(), VITAL_SIGN);
    assertEquals(2, vitals.size());
    assertEquals(1, vitals.get(0).ordinal());
    assertEquals(2, vitals.get(1).ordinal());
    assertTrue(vitals.get(0).root().index() < vitals.get(1).root().index());
    assertEquals("observation", vitals.get(0).root().localName());
    assertEquals(VITAL_SIGN, vitals.get(1).identifier());
  }

  @Test
  void absentIdentifierYieldsNothing() {
    assertTrue(locator.locate(doc.root(), "1.2.3.4").isEmpty());
    assertTrue(locator.locate(doc.root(), null).isEmpty());
  }

  @Test
  @DisplayName("the scope itself can be an occurrence")
  void scopeIsIncluded() {
    assertEquals(1, locator.locate(doc.root(), "2.16.840.1.113883.10.20.15.2").size());

    TemplateInstance second = locator.locate(doc.root(), VITAL_SIGN).get(1);
    List<TemplateInstance> within = locator.locate(second.root(), VITAL_SIGN);
    assertEquals(1, within.size());
    assertEquals(1, within.get(0).ordinal());
    assertSame(second.root().document(), within.get(0).root().document());
  }

  @Test
  @DisplayName("only direct templateId children mark an occurrence")
  void directMarkersOnly() {
    CdaDocument nested =
        TestDocuments.cda(
            "<entry><act><templateId root=\"X\"/></act></entry>"
                + "<entry><templateId root=\"Y\"/></entry>");
    List<TemplateInstance> found = locator.locate(nested.root(), "X");
    assertEquals(1, found.size());
    assertEquals("act", found.get(0).root().localName());
  }
}

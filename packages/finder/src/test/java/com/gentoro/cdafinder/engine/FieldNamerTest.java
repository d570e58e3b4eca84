package com.gentoro.cdafinder.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FieldNamerTest {

  private final FieldNamer namer = new FieldNamer();

  @Test
  @DisplayName("generic containers and template markers are skipped")
  void skipsContainers() {
    assertEquals(
        "code/code",
        namer.keyFor("observation[templateId[@root='2.16.840.1.113883.10.20.22.4.2']]/code/@code"));
    assertEquals(
        "component/value/value", namer.keyFor("organizer/component/observation/value/@value"));
  }

  @Test
  void keepsLastTwoMeaningfulSegments() {
    assertEquals(
        "patient/administrativeGenderCode/code",
        namer.keyFor(
            "ClinicalDocument/recordTarget/patientRole/patient/administrativeGenderCode/@code"));
    assertEquals("section/entry", namer.keyFor("section/entry/act"));
  }

  @Test
  @DisplayName("prefixes and predicates are stripped")
  void stripsPrefixesAndPredicates() {
    assertEquals("patient/raceCode/code", namer.keyFor("cda:patient/sdtc:raceCode/@code"));
    assertEquals("value/type", namer.keyFor("value[@code='X']/@xsi:type"));
  }

  @Test
  @DisplayName("paths made only of containers fall back to the last element")
  void fallbacks() {
    assertEquals("observation_classCode", namer.keyFor("observation/@classCode"));
    assertEquals("code", namer.keyFor("@code"));
    assertEquals("act", namer.keyFor("observation/act"));
    assertEquals("unknown_field", namer.keyFor(""));
  }

  @Test
  @DisplayName("colliding keys get a numeric suffix")
  void collisions() {
    Map<String, String> keys =
        namer.assignKeys(
            List.of("observation/code/@code", "act/code/@code", "organizer/code/@code"));
    assertEquals(
        List.of("code/code", "code/code#2", "code/code#3"), List.copyOf(keys.values()));
  }

  @Test
  void repeatedExpressionKeepsOneKey() {
    Map<String, String> keys = namer.assignKeys(List.of("section/title", "section/title"));
    assertEquals(Map.of("section/title", "section/title"), keys);
  }
}

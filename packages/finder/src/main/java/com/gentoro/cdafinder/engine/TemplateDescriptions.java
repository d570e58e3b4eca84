package com.gentoro.cdafinder.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/** Human-readable names for well-known C-CDA template identifiers. */
public class TemplateDescriptions {
  private static final Map<String, String> WELL_KNOWN =
      Map.ofEntries(
          Map.entry("2.16.840.1.113883.10.20.22.4.2", "Problem Observation"),
          Map.entry("2.16.840.1.113883.10.20.22.4.27", "Vital Signs Observation"),
          Map.entry("2.16.840.1.113883.10.20.22.4.7", "Allergy Observation"),
          Map.entry("2.16.840.1.113883.10.20.22.4.13", "Medication Activity"),
          Map.entry("2.16.840.1.113883.10.20.22.4.44", "Lab Result Observation"),
          Map.entry("2.16.840.1.113883.10.20.22.4.14", "Medication Supply Order"),
          Map.entry("2.16.840.1.113883.10.20.22.4.16", "Medication Dispense"),
          Map.entry("2.16.840.1.113883.10.20.22.4.19", "Medication Order"),
          Map.entry("2.16.840.1.113883.10.20.22.4.49", "Pregnancy Observation"),
          Map.entry("2.16.840.1.113883.10.20.22.4.78", "Smoking Status Observation"),
          Map.entry("2.16.840.1.113883.10.20.22.4.280", "Gestational Age Observation"));

  private final Map<String, String> descriptions;

  public TemplateDescriptions() {
    this(Map.of());
  }

  /** @param extra configured entries; they take precedence over the built-in ones */
  public TemplateDescriptions(Map<String, String> extra) {
    this.descriptions = new LinkedHashMap<>(WELL_KNOWN);
    this.descriptions.putAll(extra);
  }

  public String describe(String identifier) {
    String description = descriptions.get(identifier);
    return description != null ? description : "Template " + identifier;
  }
}

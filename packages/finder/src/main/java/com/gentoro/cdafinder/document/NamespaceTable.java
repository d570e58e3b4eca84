package com.gentoro.cdafinder.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Prefix to namespace URI table. One prefix is designated as the primary namespace. */
public final class NamespaceTable {
  public static final String CDA_PREFIX = "cda";
  public static final String CDA_NAMESPACE = "urn:hl7-org:v3";

  private static final NamespaceTable CDA =
      new NamespaceTable(
          Map.of(
              CDA_PREFIX, CDA_NAMESPACE,
              "xsi", "http://www.w3.org/2001/XMLSchema-instance",
              "sdtc", "urn:hl7-org:sdtc",
              "voc", "http://www.lantanagroup.com/voc"),
          CDA_PREFIX);

  private final Map<String, String> prefixes;
  private final String primaryPrefix;

  public NamespaceTable(Map<String, String> prefixes, String primaryPrefix) {
    Objects.requireNonNull(prefixes, "prefixes");
    if (!prefixes.containsKey(primaryPrefix)) {
      throw new IllegalArgumentException("Primary prefix '" + primaryPrefix + "' is not mapped");
    }
    this.prefixes = Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
    this.primaryPrefix = primaryPrefix;
  }

  /** The default CDA table: {@code cda}, {@code xsi}, {@code sdtc} and {@code voc}. */
  public static NamespaceTable cda() {
    return CDA;
  }

  public Map<String, String> prefixes() {
    return prefixes;
  }

  public String primaryPrefix() {
    return primaryPrefix;
  }

  public String primaryUri() {
    return prefixes.get(primaryPrefix);
  }

  /** @return the URI bound to {@code prefix}, or null when unbound */
  public String uri(String prefix) {
    return prefixes.get(prefix);
  }

  /** @return a prefix bound to {@code uri}, preferring the primary one, or null */
  public String prefixFor(String uri) {
    if (uri == null) return null;
    if (uri.equals(primaryUri())) return primaryPrefix;
    for (Map.Entry<String, String> e : prefixes.entrySet()) {
      if (e.getValue().equals(uri)) return e.getKey();
    }
    return null;
  }
}

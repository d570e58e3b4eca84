package com.gentoro.cdafinder.config;

import com.gentoro.cdafinder.document.NamespaceTable;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Typed view over the configuration keys the finder reads.
 *
 * @param rootElement local name of the document element that anchors absolute expressions
 * @param namespaces prefix table used to qualify steps and to render normalized paths
 * @param defaultFormat output format used when the command line does not choose one
 * @param maxNotFoundInText how many unmatched expressions the text report lists
 * @param templateDescriptions additional identifier to description entries
 */
public record FinderSettings(
    String rootElement,
    NamespaceTable namespaces,
    String defaultFormat,
    int maxNotFoundInText,
    Map<String, String> templateDescriptions) {

  public static final String DEFAULT_ROOT_ELEMENT = "ClinicalDocument";

  public static FinderSettings defaults() {
    return new FinderSettings(DEFAULT_ROOT_ELEMENT, NamespaceTable.cda(), "json", 10, Map.of());
  }

  public static FinderSettings from(Configuration config) {
    String root = config.getString("finder.root-element", DEFAULT_ROOT_ELEMENT);
    String primaryPrefix = config.getString("finder.primary-prefix", NamespaceTable.CDA_PREFIX);

    Map<String, String> prefixes = new LinkedHashMap<>(NamespaceTable.cda().prefixes());
    Configuration ns = config.subset("namespaces");
    Iterator<String> keys = ns.getKeys();
    while (keys.hasNext()) {
      String prefix = keys.next();
      String uri = ns.getString(prefix, null);
      if (StringUtils.isNotBlank(uri)) prefixes.put(prefix, uri.trim());
    }

    Map<String, String> descriptions = new LinkedHashMap<>();
    List<String> entries = config.getList(String.class, "templates.descriptions", List.of());
    for (String entry : entries) {
      int eq = entry.indexOf('=');
      if (eq <= 0 || eq == entry.length() - 1) continue;
      descriptions.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
    }

    return new FinderSettings(
        root,
        new NamespaceTable(prefixes, primaryPrefix),
        config.getString("output.format", "json"),
        Math.max(0, config.getInt("output.text.max-not-found", 10)),
        Collections.unmodifiableMap(descriptions));
  }
}

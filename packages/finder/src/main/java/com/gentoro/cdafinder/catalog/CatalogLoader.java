package com.gentoro.cdafinder.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.cdafinder.exception.CatalogException;
import com.gentoro.cdafinder.logging.LoggingService;
import com.gentoro.cdafinder.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Loads structured catalogs.
 *
 * <p>A catalog is a JSON ({@code .json}) or YAML ({@code .yaml}, {@code .yml}) list whose items
 * are either plain expression strings or objects with an {@code expression} field; every other
 * scalar field of an object becomes metadata.
 *
 * <pre>
 * - ClinicalDocument/effectiveTime/@value
 * - expression: observation[templateId[@root='2.16.840.1.113883.10.20.22.4.2']]/code/@code
 *   context: Problem Section
 *   cardinality: 1..1
 * </pre>
 */
public class CatalogLoader {
  private static final Logger log = LoggingService.getLogger(CatalogLoader.class);

  public static final String EXPRESSION_FIELD = "expression";

  public List<CatalogEntry> load(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new CatalogException("Catalog file not found: " + file);
    }
    ObjectMapper mapper = mapperFor(file);
    JsonNode root;
    try {
      root = mapper.readTree(file.toFile());
    } catch (IOException e) {
      throw new CatalogException("Unable to read catalog " + file + ": " + e.getMessage(), e);
    }
    List<CatalogEntry> entries = read(root, file.toString());
    log.info("Loaded {} catalog entries from {}", entries.size(), file);
    return entries;
  }

  /** Reads entries from an already parsed tree. */
  public List<CatalogEntry> read(JsonNode root, String source) {
    if (root == null || !root.isArray()) {
      throw new CatalogException("Catalog " + source + " must be a list of expressions");
    }
    List<CatalogEntry> entries = new ArrayList<>();
    int index = 0;
    for (JsonNode item : root) {
      entries.add(entry(item, source, index++));
    }
    return entries;
  }

  private static CatalogEntry entry(JsonNode item, String source, int index) {
    if (item.isTextual()) {
      if (StringUtils.isBlank(item.asText())) {
        throw new CatalogException("Catalog " + source + " item " + index + " is empty");
      }
      return CatalogEntry.of(item.asText());
    }
    if (!item.isObject()) {
      throw new CatalogException(
              "Catalog " + source + " item " + index + " must be a string or an object")
          .withContext("item", item.toString());
    }
    JsonNode expression = item.get(EXPRESSION_FIELD);
    if (expression == null || !expression.isTextual() || StringUtils.isBlank(expression.asText())) {
      throw new CatalogException(
          "Catalog " + source + " item " + index + " has no '" + EXPRESSION_FIELD + "'");
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getKey().equals(EXPRESSION_FIELD)) continue;
      JsonNode value = field.getValue();
      if (value.isValueNode() && !value.isNull()) metadata.put(field.getKey(), value.asText());
    }
    return new CatalogEntry(expression.asText(), metadata);
  }

  private static ObjectMapper mapperFor(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".json")) return JacksonUtility.getJsonMapper();
    if (name.endsWith(".yaml") || name.endsWith(".yml")) return JacksonUtility.getYamlMapper();
    throw new CatalogException(
        "Unsupported catalog format '" + file.getFileName() + "' (expected .json, .yaml or .yml)");
  }
}

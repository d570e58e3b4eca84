package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.expression.PathSyntax;
import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Derives short field keys from path expressions.
 *
 * <p>{@code observation[templateId[@root='X']]/code/@code} becomes {@code code/code}: the last two
 * meaningful element segments (generic containers and template markers skipped, prefixes and
 * predicates removed) plus the attribute name.
 */
public class FieldNamer {
  private static final Logger log = LoggingService.getLogger(FieldNamer.class);

  private static final Set<String> GENERIC_CONTAINERS = Set.of("observation", "organizer", "act");
  private static final int MAX_SEGMENTS = 2;

  public String keyFor(String expression) {
    List<String> segments = PathSyntax.splitSegments(expression);
    if (segments.isEmpty()) return "unknown_field";

    String attribute = null;
    String last = segments.get(segments.size() - 1);
    if (last.startsWith("@")) {
      attribute = localPart(last.substring(1));
      segments = segments.subList(0, segments.size() - 1);
    }

    List<String> meaningful = new ArrayList<>();
    for (int i = segments.size() - 1; i >= 0 && meaningful.size() < MAX_SEGMENTS; i--) {
      String raw = segments.get(i);
      if (raw.startsWith("templateId")) continue;
      String name = clean(raw);
      if (name.isEmpty() || name.equals(".") || GENERIC_CONTAINERS.contains(name)) continue;
      meaningful.add(0, name);
    }

    String lastElement = segments.isEmpty() ? null : clean(segments.get(segments.size() - 1));
    if (attribute != null) {
      if (!meaningful.isEmpty()) return String.join("/", meaningful) + "/" + attribute;
      return lastElement == null ? attribute : lastElement + "_" + attribute;
    }
    if (!meaningful.isEmpty()) return String.join("/", meaningful);
    return lastElement;
  }

  /**
   * Assigns a key to each distinct expression. A key already taken by a different expression gets
   * a {@code #2}, {@code #3}, ... suffix.
   *
   * @return expression to key, in input order
   */
  public Map<String, String> assignKeys(Collection<String> expressions) {
    Map<String, String> keys = new LinkedHashMap<>();
    Map<String, String> owners = new HashMap<>();
    for (String expression : expressions) {
      if (keys.containsKey(expression)) continue;
      String base = keyFor(expression);
      String key = base;
      for (int n = 2; owners.containsKey(key); n++) key = base + "#" + n;
      if (!key.equals(base)) {
        log.warn(
            "Field key '{}' of '{}' is already used by '{}'; using '{}'",
            base,
            expression,
            owners.get(base),
            key);
      }
      owners.put(key, expression);
      keys.put(expression, key);
    }
    return keys;
  }

  private static String clean(String segment) {
    int bracket = segment.indexOf('[');
    String name = bracket < 0 ? segment : segment.substring(0, bracket);
    return localPart(name.trim());
  }

  private static String localPart(String name) {
    int colon = name.indexOf(':');
    return colon < 0 ? name : name.substring(colon + 1);
  }
}

package com.gentoro.cdafinder.expression;

import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Step grammar of the supported path dialect.
 *
 * <p>Splits a raw path into {@link PathSegment}s on top-level {@code /} separators (those inside
 * brackets or quotes do not count) and classifies each bracket predicate. Two predicate shapes are
 * understood: {@code [@attr='value']} and {@code [child[@attr='value']]}. Any other predicate is
 * recorded as unsupported and otherwise ignored.
 *
 * <p>The grammar is deliberately small:
 *
 * <pre>
 * path      := ['/' | '//'] segment (('/' | '//') segment)*
 * segment   := '@' name | '.' | name predicate*
 * name      := [prefix ':'] ncname
 * predicate := '[' ... ']'
 * </pre>
 */
public final class PathSyntax {
  private static final Logger log = LoggingService.getLogger(PathSyntax.class);

  private static final String NCNAME = "[A-Za-z_][A-Za-z0-9_.\\-]*";
  private static final Pattern NAME = Pattern.compile("(?:(" + NCNAME + "):)?(" + NCNAME + ")");
  private static final Pattern ATTRIBUTE_EQUALS =
      Pattern.compile("@((?:" + NCNAME + ":)?" + NCNAME + ")\\s*=\\s*(['\"])(.*?)\\2");
  private static final Pattern CHILD_ATTRIBUTE_EQUALS =
      Pattern.compile(
          "(?:("
              + NCNAME
              + "):)?("
              + NCNAME
              + ")\\s*\\[\\s*@((?:"
              + NCNAME
              + ":)?"
              + NCNAME
              + ")\\s*=\\s*(['\"])(.*?)\\4\\s*]");

  /** What a segment selects. */
  public enum Kind {
    ELEMENT,
    ATTRIBUTE,
    SELF
  }

  /**
   * A recognized bracket predicate. {@code childName} is null for {@code [@attr='value']}.
   *
   * @param childPrefix prefix written on the child name, or null
   * @param childName child element local name, or null for an attribute-equality predicate
   * @param attribute attribute name as written
   * @param value required attribute value
   */
  public record Condition(String childPrefix, String childName, String attribute, String value) {
    public boolean isChildCondition() {
      return childName != null;
    }
  }

  /**
   * One parsed segment.
   *
   * @param axis axis introduced by the separator before the segment
   * @param kind element, attribute or self segment
   * @param prefix namespace prefix as written, or null
   * @param name local name (element or attribute); null for a self segment
   * @param conditions recognized predicates in source order
   * @param unsupported raw text of predicates that were not recognized
   */
  public record PathSegment(
      Axis axis,
      Kind kind,
      String prefix,
      String name,
      List<Condition> conditions,
      List<String> unsupported) {
    public PathSegment {
      conditions = List.copyOf(conditions);
      unsupported = List.copyOf(unsupported);
    }

    /** Attribute name with its prefix, as it appears as an attribute key. */
    public String qualifiedName() {
      return prefix == null ? name : prefix + ":" + name;
    }

    public PathSegment withAxis(Axis newAxis) {
      return new PathSegment(newAxis, kind, prefix, name, conditions, unsupported);
    }

    public PathSegment withConditions(List<Condition> newConditions) {
      return new PathSegment(axis, kind, prefix, name, newConditions, unsupported);
    }
  }

  /** Result of {@link #parse(String)}. */
  public record ParsedPath(boolean absolute, List<PathSegment> segments) {
    public ParsedPath {
      segments = List.copyOf(segments);
    }
  }

  /**
   * Parses {@code raw} into segments.
   *
   * @throws ExpressionConversionException when the syntax is malformed
   */
  public ParsedPath parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ExpressionConversionException("Path expression must not be empty");
    }
    String path = raw.trim();
    int i = 0;
    boolean absolute = false;
    Axis pending = Axis.CHILD;
    if (path.startsWith("//")) {
      pending = Axis.DESCENDANT;
      absolute = true;
      i = 2;
    } else if (path.startsWith("/")) {
      absolute = true;
      i = 1;
    }

    List<PathSegment> segments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int depth = 0;
    char quote = 0;
    for (; i < path.length(); i++) {
      char c = path.charAt(i);
      if (quote != 0) {
        if (c == quote) quote = 0;
        current.append(c);
        continue;
      }
      if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '[') {
        depth++;
      } else if (c == ']') {
        if (--depth < 0) throw malformed(raw, "unbalanced ']' at position " + i);
      } else if (c == '/' && depth == 0) {
        segments.add(parseSegment(raw, current.toString(), pending));
        current.setLength(0);
        pending = Axis.CHILD;
        if (i + 1 < path.length() && path.charAt(i + 1) == '/') {
          pending = Axis.DESCENDANT;
          i++;
        }
        continue;
      }
      current.append(c);
    }
    if (quote != 0) throw malformed(raw, "unterminated quote");
    if (depth != 0) throw malformed(raw, "unbalanced '['");
    if (current.length() == 0) {
      throw malformed(raw, segments.isEmpty() ? "no steps" : "trailing separator");
    }
    segments.add(parseSegment(raw, current.toString(), pending));

    for (int s = 0; s < segments.size() - 1; s++) {
      if (segments.get(s).kind() == Kind.ATTRIBUTE) {
        throw malformed(
            raw, "attribute step '@" + segments.get(s).qualifiedName() + "' is not last");
      }
    }
    return new ParsedPath(absolute, segments);
  }

  /**
   * Splits {@code raw} on top-level separators without validating anything. Empty segments are
   * skipped. Used where a best-effort view of the written steps is enough.
   */
  public static List<String> splitSegments(String raw) {
    List<String> out = new ArrayList<>();
    if (raw == null) return out;
    StringBuilder current = new StringBuilder();
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (quote != 0) {
        if (c == quote) quote = 0;
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth = Math.max(0, depth - 1);
      } else if (c == '/' && depth == 0) {
        if (current.length() > 0) out.add(current.toString().trim());
        current.setLength(0);
        continue;
      }
      current.append(c);
    }
    if (current.length() > 0) out.add(current.toString().trim());
    out.removeIf(String::isEmpty);
    return out;
  }

  private PathSegment parseSegment(String raw, String text, Axis axis) {
    String segment = text.trim();
    if (segment.isEmpty()) throw malformed(raw, "empty step");

    if (segment.equals(".")) {
      return new PathSegment(axis, Kind.SELF, null, null, List.of(), List.of());
    }
    if (segment.startsWith("@")) {
      Matcher m = NAME.matcher(segment.substring(1));
      if (!m.matches()) throw malformed(raw, "illegal attribute name '" + segment + "'");
      return new PathSegment(axis, Kind.ATTRIBUTE, m.group(1), m.group(2), List.of(), List.of());
    }

    int bracket = segment.indexOf('[');
    String name = bracket < 0 ? segment : segment.substring(0, bracket).trim();
    Matcher m = NAME.matcher(name);
    if (!m.matches()) {
      throw malformed(raw, name.isEmpty() ? "empty step name" : "illegal step name '" + name + "'");
    }

    List<Condition> conditions = new ArrayList<>();
    List<String> unsupported = new ArrayList<>();
    if (bracket >= 0) {
      for (String predicate : predicates(raw, segment.substring(bracket))) {
        Condition condition = classify(predicate);
        if (condition != null) {
          conditions.add(condition);
        } else {
          log.debug("Ignoring unsupported predicate [{}] in '{}'", predicate, raw);
          unsupported.add(predicate);
        }
      }
    }
    return new PathSegment(axis, Kind.ELEMENT, m.group(1), m.group(2), conditions, unsupported);
  }

  /** Splits {@code [a][b[c]]} into {@code a} and {@code b[c]}. */
  private List<String> predicates(String raw, String text) {
    List<String> out = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      if (c != '[') throw malformed(raw, "unexpected '" + c + "' after predicate");
      int depth = 0;
      char quote = 0;
      int start = i + 1;
      int end = -1;
      for (; i < text.length(); i++) {
        char d = text.charAt(i);
        if (quote != 0) {
          if (d == quote) quote = 0;
        } else if (d == '\'' || d == '"') {
          quote = d;
        } else if (d == '[') {
          depth++;
        } else if (d == ']' && --depth == 0) {
          end = i;
          break;
        }
      }
      if (end < 0) throw malformed(raw, "unbalanced '['");
      String inner = text.substring(start, end).trim();
      if (inner.isEmpty()) throw malformed(raw, "empty predicate");
      out.add(inner);
      i = end + 1;
    }
    return out;
  }

  private static Condition classify(String predicate) {
    Matcher attr = ATTRIBUTE_EQUALS.matcher(predicate);
    if (attr.matches()) return new Condition(null, null, attr.group(1), attr.group(3));
    Matcher child = CHILD_ATTRIBUTE_EQUALS.matcher(predicate);
    if (child.matches()) {
      return new Condition(child.group(1), child.group(2), child.group(3), child.group(5));
    }
    return null;
  }

  private static ExpressionConversionException malformed(String raw, String reason) {
    return new ExpressionConversionException(
        "Malformed path expression '%s': %s".formatted(raw, reason));
  }
}

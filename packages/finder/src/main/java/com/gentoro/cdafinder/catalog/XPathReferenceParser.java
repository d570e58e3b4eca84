package com.gentoro.cdafinder.catalog;

import com.gentoro.cdafinder.exception.CatalogException;
import com.gentoro.cdafinder.logging.LoggingService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Mines path expressions out of free text, such as an implementation guide pasted into a file.
 *
 * <p>Each line is scanned for tokens that look like paths. A token is kept when, after trimming
 * punctuation around it, it is at least {@value #MIN_LENGTH} characters long, contains {@code /} or
 * {@code @}, starts with a letter and is neither a version number nor a word glued to an attribute
 * (an e-mail address, for instance). Cardinality and template identifier written on the same line
 * become metadata. Repeated expressions keep their first occurrence.
 */
public class XPathReferenceParser {
  private static final Logger log = LoggingService.getLogger(XPathReferenceParser.class);

  static final int MIN_LENGTH = 10;

  private static final Pattern CANDIDATE =
      Pattern.compile(
          "[A-Za-z]+[A-Za-z0-9/\\[\\]@='\":.\\-_]*(?:/[A-Za-z@\\[\\]0-9='\":.\\-_]+)*");
  private static final Pattern LEADING_NOISE = Pattern.compile("^[^A-Za-z/]+");
  private static final Pattern TRAILING_NOISE = Pattern.compile("[^A-Za-z0-9\\]]+$");
  private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+");
  private static final Pattern GLUED_ATTRIBUTE = Pattern.compile("^[^/\\[]*@[^/\\[]*$");
  private static final Pattern CARDINALITY_RANGE = Pattern.compile("\\b(\\d+\\.\\.(?:\\*|\\d+))");
  private static final Pattern CARDINALITY_SINGLE = Pattern.compile("(?<![\\w.])(\\d+)(?![\\w.])");
  private static final Pattern TEMPLATE = Pattern.compile("templateId\\[@root=['\"]([^'\"]+)['\"]");

  public List<CatalogEntry> parse(String content) {
    List<CatalogEntry> entries = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    if (content == null) return entries;

    for (String rawLine : content.split("\\R")) {
      String line = rawLine.strip();
      if (line.isEmpty()) continue;
      Matcher m = CANDIDATE.matcher(line);
      while (m.find()) {
        String token = m.group();
        if (token.length() <= 5 || (token.indexOf('/') < 0 && token.indexOf('@') < 0)) continue;
        String expression = clean(token);
        if (!isPlausible(expression) || !seen.add(expression)) continue;
        entries.add(new CatalogEntry(expression, metadata(line)));
      }
    }
    log.debug("Extracted {} expression(s) from reference text", entries.size());
    return entries;
  }

  public List<CatalogEntry> parse(Path file) {
    try {
      return parse(Files.readString(file, StandardCharsets.UTF_8));
    } catch (NoSuchFileException e) {
      throw new CatalogException("Reference file not found: " + file, e);
    } catch (IOException e) {
      throw new CatalogException(
          "Unable to read reference file " + file + ": " + e.getMessage(), e);
    }
  }

  static String clean(String token) {
    String cleaned = LEADING_NOISE.matcher(token).replaceFirst("");
    cleaned = TRAILING_NOISE.matcher(cleaned).replaceFirst("");
    return cleaned.replace("\\", "").strip();
  }

  static boolean isPlausible(String expression) {
    if (expression.length() < MIN_LENGTH) return false;
    if (expression.indexOf('/') < 0 && expression.indexOf('@') < 0) return false;
    if (!Character.isLetter(expression.charAt(0))) return false;
    if (VERSION.matcher(expression).find()) return false;
    return !GLUED_ATTRIBUTE.matcher(expression).matches();
  }

  private static Map<String, String> metadata(String line) {
    Map<String, String> metadata = new LinkedHashMap<>();
    Matcher range = CARDINALITY_RANGE.matcher(line);
    Matcher single = CARDINALITY_SINGLE.matcher(line);
    if (range.find()) {
      metadata.put(CatalogEntry.CARDINALITY, range.group(1));
    } else if (single.find()) {
      metadata.put(CatalogEntry.CARDINALITY, single.group(1));
    }
    Matcher template = TEMPLATE.matcher(line);
    if (template.find()) metadata.put(CatalogEntry.TEMPLATE, template.group(1));
    return metadata;
  }
}

package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.catalog.CatalogEntry;
import com.gentoro.cdafinder.catalog.CatalogGrouper;
import com.gentoro.cdafinder.catalog.CatalogGroups;
import com.gentoro.cdafinder.catalog.ConvertedEntry;
import com.gentoro.cdafinder.config.FinderSettings;
import com.gentoro.cdafinder.document.CdaDocument;
import com.gentoro.cdafinder.expression.ConvertedExpression;
import com.gentoro.cdafinder.expression.ExpressionConversionException;
import com.gentoro.cdafinder.expression.ExpressionConverter;
import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Entry point of the matching engine.
 *
 * <p>Three modes are offered:
 *
 * <ul>
 *   <li>{@link #findElements}: every entry evaluated against the whole document, one {@link
 *       ExpressionMatch} per entry;
 *   <li>{@link #findGroup}: entries evaluated once per occurrence of one template;
 *   <li>{@link #findGrouped}: the catalog partitioned by template identifier, one group per
 *       identifier that has data.
 * </ul>
 *
 * Entries whose expression cannot be converted are logged and skipped in every mode.
 */
public class CdaElementFinder {
  private static final Logger log = LoggingService.getLogger(CdaElementFinder.class);

  private final ExpressionConverter converter;
  private final TreeMatcher matcher;
  private final InstanceGrouper grouper;
  private final CatalogGrouper catalogGrouper;

  public CdaElementFinder(
      ExpressionConverter converter, TreeMatcher matcher, InstanceGrouper grouper) {
    this.converter = Objects.requireNonNull(converter, "converter");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.grouper = Objects.requireNonNull(grouper, "grouper");
    this.catalogGrouper = new CatalogGrouper(converter);
  }

  /** Wires the default engine for {@code settings}. */
  public static CdaElementFinder create(FinderSettings settings) {
    TemplateLocator locator = new TemplateLocator(settings.namespaces());
    TreeMatcher matcher = new TreeMatcher(locator);
    InstanceGrouper grouper =
        new InstanceGrouper(
            matcher,
            locator,
            new ScopeBoundaryResolver(settings.namespaces()),
            new FieldNamer(),
            new TemplateDescriptions(settings.templateDescriptions()));
    return new CdaElementFinder(new ExpressionConverter(settings), matcher, grouper);
  }

  /** Flat mode. Entries that fail conversion produce no result. */
  public List<ExpressionMatch> findElements(CdaDocument document, List<CatalogEntry> entries) {
    List<ExpressionMatch> out = new ArrayList<>(entries.size());
    for (CatalogEntry entry : entries) {
      ConvertedExpression expression = convert(entry);
      if (expression == null) continue;
      out.add(new ExpressionMatch(entry, expression, matcher.match(document.root(), expression)));
    }
    long found = out.stream().filter(ExpressionMatch::found).count();
    log.info("Matched {} of {} expression(s) in {}", found, out.size(), document.source());
    return out;
  }

  /** Evaluates {@code entries} once per occurrence of {@code identifier}. */
  public InstanceGroup findGroup(
      CdaDocument document, String identifier, List<CatalogEntry> entries) {
    List<ConvertedExpression> expressions = new ArrayList<>();
    for (CatalogEntry entry : entries) {
      ConvertedExpression expression = convert(entry);
      if (expression != null) expressions.add(expression);
    }
    return grouper.group(document.root(), identifier, expressions);
  }

  /** Partitions {@code entries} by template identifier. */
  public CatalogGroups groupCatalog(List<CatalogEntry> entries) {
    return catalogGrouper.group(entries);
  }

  /** Auto-grouping over a whole catalog. */
  public List<InstanceGroup> findGrouped(CdaDocument document, List<CatalogEntry> entries) {
    return findGrouped(document, groupCatalog(entries));
  }

  /**
   * One group per identifier of {@code groups} that has at least one occurrence with data, in
   * first-seen order. Ungrouped entries are not evaluated here.
   */
  public List<InstanceGroup> findGrouped(CdaDocument document, CatalogGroups groups) {
    List<InstanceGroup> out = new ArrayList<>();
    for (Map.Entry<String, List<ConvertedEntry>> e : groups.grouped().entrySet()) {
      List<ConvertedExpression> expressions = new ArrayList<>();
      for (ConvertedEntry converted : e.getValue()) expressions.add(converted.expression());
      InstanceGroup group = grouper.group(document.root(), e.getKey(), expressions);
      if (group.instanceCount() > 0) out.add(group);
    }
    return out;
  }

  private ConvertedExpression convert(CatalogEntry entry) {
    try {
      return converter.convert(entry.expression());
    } catch (ExpressionConversionException e) {
      log.warn("Skipping catalog entry: {}", e.getMessage());
      return null;
    }
  }
}

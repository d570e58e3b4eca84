package com.gentoro.cdafinder;

import com.gentoro.cdafinder.catalog.CatalogEntry;
import com.gentoro.cdafinder.catalog.CatalogGroups;
import com.gentoro.cdafinder.catalog.CatalogLoader;
import com.gentoro.cdafinder.catalog.ConvertedEntry;
import com.gentoro.cdafinder.catalog.DefaultReference;
import com.gentoro.cdafinder.catalog.XPathReferenceParser;
import com.gentoro.cdafinder.config.FinderSettings;
import com.gentoro.cdafinder.document.CdaDocument;
import com.gentoro.cdafinder.document.CdaDocumentParser;
import com.gentoro.cdafinder.engine.CdaElementFinder;
import com.gentoro.cdafinder.engine.InstanceGroup;
import com.gentoro.cdafinder.logging.LoggingService;
import com.gentoro.cdafinder.output.CombinedReport;
import com.gentoro.cdafinder.output.FlatResult;
import com.gentoro.cdafinder.output.GroupedResult;
import com.gentoro.cdafinder.output.OutputFormat;
import com.gentoro.cdafinder.output.OutputFormatter;
import com.gentoro.cdafinder.output.ResultMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Runs one finder invocation: reads the document and the catalog, evaluates it in the requested
 * mode and renders the result.
 */
public class CdaFinder {
  private static final Logger log = LoggingService.getLogger(CdaFinder.class);

  /**
   * What to run.
   *
   * @param document the CDA document
   * @param catalog structured catalog (JSON or YAML), or null
   * @param reference free-text reference to mine for expressions, or null
   * @param output file to write the rendered result to, or null
   * @param format output format
   * @param autoGroup group expressions by template identifier
   * @param showBoth render ungrouped expressions individually next to the groups
   */
  public record Request(
      Path document,
      Path catalog,
      Path reference,
      Path output,
      OutputFormat format,
      boolean autoGroup,
      boolean showBoth) {
    public Request {
      Objects.requireNonNull(document, "document");
      Objects.requireNonNull(format, "format");
    }
  }

  private final CdaDocumentParser parser = new CdaDocumentParser();
  private final CatalogLoader catalogLoader = new CatalogLoader();
  private final XPathReferenceParser referenceParser = new XPathReferenceParser();
  private final CdaElementFinder finder;
  private final OutputFormatter formatter;

  public CdaFinder(FinderSettings settings) {
    this.finder = CdaElementFinder.create(settings);
    this.formatter = new OutputFormatter(settings.maxNotFoundInText());
  }

  /**
   * Runs {@code request} and returns the rendered result. The result is also written to the
   * request's output file when one is set.
   */
  public String run(Request request) {
    CdaDocument document = parser.parse(request.document());
    List<CatalogEntry> entries = catalog(request);
    log.info("Evaluating {} expression(s) against {}", entries.size(), request.document());

    String rendered;
    if (request.showBoth()) {
      CatalogGroups groups = finder.groupCatalog(entries);
      List<CatalogEntry> ungrouped = new ArrayList<>();
      for (ConvertedEntry converted : groups.ungrouped()) ungrouped.add(converted.entry());
      List<FlatResult> individual =
          ResultMapper.toFlatResults(finder.findElements(document, ungrouped));
      List<GroupedResult> grouped =
          ResultMapper.toGroupedResults(finder.findGrouped(document, groups));
      rendered = formatter.formatCombined(CombinedReport.of(individual, grouped), request.format());
    } else if (request.autoGroup()) {
      List<InstanceGroup> groups = finder.findGrouped(document, entries);
      rendered = formatter.formatGrouped(ResultMapper.toGroupedResults(groups), request.format());
    } else {
      rendered =
          formatter.formatFlat(
              ResultMapper.toFlatResults(finder.findElements(document, entries)), request.format());
    }

    if (request.output() != null) formatter.write(rendered, request.output());
    return rendered;
  }

  /** Catalog entries first, then mined reference entries; the built-in reference when neither. */
  List<CatalogEntry> catalog(Request request) {
    List<CatalogEntry> entries = new ArrayList<>();
    if (request.catalog() != null) entries.addAll(catalogLoader.load(request.catalog()));
    if (request.reference() != null) entries.addAll(referenceParser.parse(request.reference()));
    if (request.catalog() == null && request.reference() == null) {
      log.info("No catalog given, using the built-in reference expressions");
      entries.addAll(referenceParser.parse(DefaultReference.text()));
    }
    return entries;
  }
}

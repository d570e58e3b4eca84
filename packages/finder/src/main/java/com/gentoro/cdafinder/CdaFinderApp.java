package com.gentoro.cdafinder;

import com.gentoro.cdafinder.config.ConfigurationProvider;
import com.gentoro.cdafinder.config.FinderSettings;
import com.gentoro.cdafinder.exception.CdaFinderException;
import com.gentoro.cdafinder.exception.ExceptionUtil;
import com.gentoro.cdafinder.logging.LoggingService;
import com.gentoro.cdafinder.output.OutputFormat;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * cda-finder &lt;cda.xml&gt; [--catalog file] [--xpath-ref file] [--output file]
 *            [--format json|csv|text] [--auto-group] [--show-both] [--config file]
 * </pre>
 *
 * Results go to standard output unless {@code --output} is given; logging goes to standard error.
 */
public class CdaFinderApp {
  private static final Logger log = LoggingService.getLogger(CdaFinderApp.class);

  static final String USAGE = "cda-finder <cda.xml> [options]";

  private final PrintStream out;
  private final PrintStream err;

  CdaFinderApp(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new CdaFinderApp(System.out, System.err).run(args));
  }

  static Options options() {
    Options options = new Options();
    options.addOption(new Option("h", "help", false, "Output this help message."));
    options.addOption(
        Option.builder("c")
            .longOpt("catalog")
            .hasArg()
            .argName("file")
            .desc("Structured catalog of expressions (.json, .yaml or .yml).")
            .build());
    options.addOption(
        Option.builder("x")
            .longOpt("xpath-ref")
            .hasArg()
            .argName("file")
            .desc("Free-text reference document to extract expressions from.")
            .build());
    options.addOption(
        Option.builder("o")
            .longOpt("output")
            .hasArg()
            .argName("file")
            .desc("Write results to this file instead of standard output.")
            .build());
    options.addOption(
        Option.builder("f")
            .longOpt("format")
            .hasArg()
            .argName("json|csv|text")
            .desc("Output format; default from configuration (json).")
            .build());
    options.addOption(
        Option.builder()
            .longOpt("auto-group")
            .desc("Group expressions by template identifier.")
            .build());
    options.addOption(
        Option.builder()
            .longOpt("show-both")
            .desc("Show individual results for ungrouped expressions next to the grouped results.")
            .build());
    options.addOption(
        Option.builder()
            .longOpt("config")
            .hasArg()
            .argName("file")
            .desc("YAML configuration overriding the bundled defaults.")
            .build());
    return options;
  }

  /** Runs the command line and returns the process exit code. */
  int run(String[] args) {
    Options options = options();
    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException pe) {
      err.println("Parse of command-line failed: " + pe.getMessage());
      return 1;
    }
    if (cli.hasOption("help")) {
      printHelp(options);
      return 0;
    }
    if (cli.getArgList().size() != 1) {
      err.println("Exactly one CDA document is required");
      printHelp(options);
      return 1;
    }

    try {
      ConfigurationProvider provider = new ConfigurationProvider(path(cli, "config"));
      LoggingService.applyConfiguration(provider.configuration());
      FinderSettings settings = FinderSettings.from(provider.configuration());

      OutputFormat format =
          OutputFormat.fromName(cli.getOptionValue("format", settings.defaultFormat()));
      boolean showBoth = cli.hasOption("show-both");
      CdaFinder.Request request =
          new CdaFinder.Request(
              Path.of(cli.getArgList().get(0)),
              path(cli, "catalog"),
              path(cli, "xpath-ref"),
              path(cli, "output"),
              format,
              showBoth || cli.hasOption("auto-group"),
              showBoth);

      String rendered = new CdaFinder(settings).run(request);
      if (request.output() == null) {
        out.print(rendered);
        out.flush();
      } else {
        out.println("Results saved to: " + request.output());
      }
      return 0;
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return 1;
    } catch (CdaFinderException e) {
      log.debug(
          "Run failed: {} at {}",
          ExceptionUtil.toErrorDetails(e),
          ExceptionUtil.formatCompactStackTrace(e));
      err.println("Error: " + ExceptionUtil.extractErrorMessage(e));
      return 1;
    }
  }

  private void printHelp(Options options) {
    PrintWriter writer = new PrintWriter(out);
    new HelpFormatter()
        .printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options, 2, 4, null, false);
    writer.flush();
  }

  private static Path path(CommandLine cli, String option) {
    String value = cli.getOptionValue(option);
    return value == null ? null : Path.of(value);
  }
}

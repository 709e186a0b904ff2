package temporal.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.cli.CliParsers.OptionSpec;
import temporal.core.AnalysisReport;
import temporal.core.EngineOptions;
import temporal.core.TemporalGraphEngine;
import temporal.core.model.TemporalGraph;
import temporal.io.AnalysisReportJson;
import temporal.io.TemporalGraphJson;
import temporal.treewidth.WindowTreewidth;

/**
 * Handles the `analyze` command: tree-width of one window, Δ-differential tree-width, maximum
 * degree and eternal twins. Window defaults to {@code t=0, delta=2}.
 */
final class AnalyzeCommand {
  private static final Logger LOG = LoggerFactory.getLogger(AnalyzeCommand.class);

  private final EngineOptions baseOptions;

  AnalyzeCommand(EngineOptions baseOptions) {
    this.baseOptions = baseOptions;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(CliParsers.tail(args), optionSpecs());
    TemporalGraph graph = TemporalGraphJson.read(options.requireGraphFile());

    EngineOptions engineOptions = baseOptions;
    if (options.exactLimit() != null) {
      engineOptions = engineOptions.withExactNodeLimit(options.exactLimit());
    }
    if (options.parallel()) {
      engineOptions = engineOptions.withParallel(true);
    }
    TemporalGraphEngine engine = new TemporalGraphEngine(engineOptions);

    AnalysisReport report =
        engine.treewidth(graph, options.startOrDefault(), options.deltaOrDefault());
    logSummary(report);
    CliParsers.emit(new AnalysisReportJson().build(report), options.outFile());
    return 0;
  }

  private void logSummary(AnalysisReport report) {
    LOG.info(
        "Window {}: tw={} ({}), max degree {}",
        report.window(),
        report.currentTreewidth(),
        report.current().mode(),
        report.maxDegree());
    LOG.info(
        "dtw_{} = {} (first reached at t={})",
        report.differential().delta(),
        report.dtwDelta(),
        report.differential().argMinimum());
    for (WindowTreewidth window : report.differential().perStart()) {
      LOG.debug("  t={} tw={} ({})", window.start(), window.width(), window.report().mode());
    }
    LOG.info("Eternal twins: {}", report.eternalTwins().size());
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = CliParsers.specs();
    specs.put("--graph", OptionSpec.withValue((b, raw) -> b.graphFile(Path.of(raw))));
    specs.put(
        "--start", OptionSpec.withValue((b, raw) -> b.start(CliParsers.parseInt(raw, "--start"))));
    specs.put(
        "--delta", OptionSpec.withValue((b, raw) -> b.delta(CliParsers.parseInt(raw, "--delta"))));
    specs.put(
        "--window",
        OptionSpec.withValue(
            (b, raw) -> {
              int[] window = CliParsers.parseWindow(raw);
              b.start(window[0]).delta(window[1]);
            }));
    specs.put(
        "--exact-limit",
        OptionSpec.withValue(
            (b, raw) -> b.exactLimit(CliParsers.parseInt(raw, "--exact-limit"))));
    specs.put("--parallel", OptionSpec.flag(b -> b.parallel(true)));
    specs.put("--out", OptionSpec.withValue((b, raw) -> b.outFile(Path.of(raw))));
    return specs;
  }
}

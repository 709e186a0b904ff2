package temporal.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.cli.CliParsers.OptionSpec;
import temporal.core.TemporalGraphEngine;
import temporal.core.model.TemporalGraph;
import temporal.expansion.ExpansionGraph;
import temporal.expansion.TimeWindow;
import temporal.io.ExpansionGraphJson;
import temporal.io.TemporalGraphJson;

/**
 * Handles the `expand` command. Without a window the full static expansion is produced;
 * otherwise the differential at {@code --start}/{@code --delta}.
 */
final class ExpandCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ExpandCommand.class);

  private final TemporalGraphEngine engine;

  ExpandCommand(TemporalGraphEngine engine) {
    this.engine = engine;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(CliParsers.tail(args), optionSpecs());
    TemporalGraph graph = TemporalGraphJson.read(options.requireGraphFile());
    TimeWindow window =
        options.hasWindow()
            ? TimeWindow.of(options.startOrDefault(), options.deltaOrDefault())
            : null;
    ExpansionGraph expansion = engine.expand(graph, window);
    LOG.info("Expansion over {}: {}", expansion.window(), expansion.summary());
    CliParsers.emit(ExpansionGraphJson.write(expansion), options.outFile());
    return 0;
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
    specs.put("--out", OptionSpec.withValue((b, raw) -> b.outFile(Path.of(raw))));
    return specs;
  }
}

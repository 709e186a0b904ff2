package temporal.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.cli.CliParsers.OptionSpec;
import temporal.core.TemporalGraphEngine;
import temporal.core.model.TemporalGraph;
import temporal.io.TemporalGraphJson;

/** Handles the `generate` command: draws a random temporal graph and prints it as JSON. */
final class GenerateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

  private final TemporalGraphEngine engine;

  GenerateCommand(TemporalGraphEngine engine) {
    this.engine = engine;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(CliParsers.tail(args), optionSpecs());
    TemporalGraph graph = engine.generateRandom(options.randomGraphConfig());
    LOG.info(
        "Generated {} vertices x {} snapshots, edges per snapshot {}",
        graph.vertexCount(),
        graph.lifetime(),
        graph.snapshotEdgeCounts());
    CliParsers.emit(TemporalGraphJson.write(graph), options.outFile());
    return 0;
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = CliParsers.specs();
    specs.put(
        "--vertices",
        OptionSpec.withValue((b, raw) -> b.vertices(CliParsers.parseInt(raw, "--vertices"))));
    specs.put(
        "--snapshots",
        OptionSpec.withValue((b, raw) -> b.snapshots(CliParsers.parseInt(raw, "--snapshots"))));
    specs.put(
        "--probability",
        OptionSpec.withValue(
            (b, raw) -> b.probability(CliParsers.parseDouble(raw, "--probability"))));
    specs.put(
        "--seed", OptionSpec.withValue((b, raw) -> b.seed(CliParsers.parseLong(raw, "--seed"))));
    specs.put("--out", OptionSpec.withValue((b, raw) -> b.outFile(Path.of(raw))));
    return specs;
  }
}

package temporal.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.cli.CliParsers.OptionSpec;
import temporal.core.TemporalGraphEngine;
import temporal.core.model.TemporalGraph;
import temporal.core.model.TwinPair;
import temporal.io.TemporalGraphJson;

/** Handles the `twins` command: lists eternal-twin pairs of a graph file. */
final class TwinsCommand {
  private static final Logger LOG = LoggerFactory.getLogger(TwinsCommand.class);
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private final TemporalGraphEngine engine;

  TwinsCommand(TemporalGraphEngine engine) {
    this.engine = engine;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(CliParsers.tail(args), optionSpecs());
    TemporalGraph graph = TemporalGraphJson.read(options.requireGraphFile());
    Set<TwinPair> twins = engine.detectEternalTwins(graph);
    LOG.info("Found {} eternal twin pair(s) in {}", twins.size(), graph);

    List<Map<String, Integer>> pairs = new ArrayList<>(twins.size());
    for (TwinPair pair : twins) {
      Map<String, Integer> entry = new LinkedHashMap<>();
      entry.put("u", pair.u());
      entry.put("v", pair.v());
      pairs.add(entry);
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("eternal_twins", pairs);
    root.put("num_eternal_twins", twins.size());
    CliParsers.emit(GSON.toJson(root), options.outFile());
    return 0;
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = CliParsers.specs();
    specs.put("--graph", OptionSpec.withValue((b, raw) -> b.graphFile(Path.of(raw))));
    specs.put("--out", OptionSpec.withValue((b, raw) -> b.outFile(Path.of(raw))));
    return specs;
  }
}

package temporal.core;

import com.google.common.base.Stopwatch;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.analysis.DegreeAnalyzer;
import temporal.analysis.TwinDetector;
import temporal.core.model.TemporalGraph;
import temporal.core.model.TwinPair;
import temporal.expansion.ExpansionGraph;
import temporal.expansion.StaticExpansionBuilder;
import temporal.expansion.TimeWindow;
import temporal.generator.RandomGraphConfig;
import temporal.generator.RandomGraphGenerator;
import temporal.treewidth.DifferentialTreewidth;
import temporal.treewidth.DifferentialTreewidthReport;
import temporal.treewidth.TreewidthEngine;
import temporal.treewidth.TreewidthReport;

/**
 * Entry point to the engine's four operations: random generation, expansion, eternal-twin
 * detection and tree-width analysis.
 *
 * <p>The engine keeps no state between calls; every call works on the graph it is given and
 * builds its own expansions.
 */
public final class TemporalGraphEngine {
  private static final Logger LOG = LoggerFactory.getLogger(TemporalGraphEngine.class);

  private final EngineOptions options;
  private final RandomGraphGenerator generator = new RandomGraphGenerator();
  private final StaticExpansionBuilder builder = new StaticExpansionBuilder();
  private final TwinDetector twinDetector = new TwinDetector();
  private final DegreeAnalyzer degreeAnalyzer = new DegreeAnalyzer();
  private final TreewidthEngine treewidthEngine;
  private final DifferentialTreewidth differentialTreewidth;

  public TemporalGraphEngine() {
    this(EngineOptions.defaults());
  }

  public TemporalGraphEngine(EngineOptions options) {
    this.options = EngineOptions.normalize(options);
    this.treewidthEngine = this.options.treewidthEngine();
    this.differentialTreewidth =
        new DifferentialTreewidth(treewidthEngine, this.options.differentialConfig());
  }

  public EngineOptions options() {
    return options;
  }

  public TemporalGraph generateRandom(int vertexCount, int lifetime, double edgeProbability) {
    return generateRandom(new RandomGraphConfig(vertexCount, lifetime, edgeProbability, null));
  }

  public TemporalGraph generateRandom(RandomGraphConfig config) {
    return generator.generate(config);
  }

  /** Full static expansion. */
  public ExpansionGraph expand(TemporalGraph graph) {
    return builder.expand(graph);
  }

  /** Windowed differential; a {@code null} window means the full lifetime. */
  public ExpansionGraph expand(TemporalGraph graph, TimeWindow window) {
    return window == null ? builder.expand(graph) : builder.expand(graph, window);
  }

  public Set<TwinPair> detectEternalTwins(TemporalGraph graph) {
    return twinDetector.detect(graph);
  }

  public TreewidthReport treewidth(ExpansionGraph expansion) {
    return treewidthEngine.treewidth(expansion);
  }

  public DifferentialTreewidthReport differentialTreewidth(TemporalGraph graph, int delta) {
    return differentialTreewidth.compute(graph, delta);
  }

  /**
   * Analyses the window {@code (start, delta)}: its tree-width and maximum degree, the
   * Δ-differential tree-width over all starts, and whole-graph statistics.
   *
   * @throws InvalidWindowException when {@code delta > lifetime} or {@code start + delta >
   *     lifetime}
   */
  public AnalysisReport treewidth(TemporalGraph graph, int start, int delta) {
    Objects.requireNonNull(graph, "graph");
    TimeWindow window = TimeWindow.of(start, delta).validateAgainst(graph.lifetime());
    Stopwatch stopwatch = Stopwatch.createStarted();

    ExpansionGraph expansion = builder.expand(graph, window);
    TreewidthReport current = treewidthEngine.treewidth(expansion);
    int maxDegree = degreeAnalyzer.maxDegree(expansion);
    DifferentialTreewidthReport differential = differentialTreewidth.compute(graph, delta);
    Set<TwinPair> twins = twinDetector.detect(graph);

    AnalysisReport report =
        new AnalysisReport(
            window,
            current,
            differential,
            maxDegree,
            twins,
            graph.lifetime(),
            graph.vertexCount(),
            graph.snapshotEdgeCounts(),
            graph.unionEdges().size());
    LOG.debug(
        "Analysed {} at {}: tw={} ({}), dtw={}, maxDegree={}, twins={} in {}",
        graph,
        window,
        current.width(),
        current.mode(),
        differential.minimum(),
        maxDegree,
        twins.size(),
        stopwatch.stop());
    return report;
  }
}

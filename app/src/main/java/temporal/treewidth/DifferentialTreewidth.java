package temporal.treewidth;

import com.google.common.base.Stopwatch;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.core.InvalidWindowException;
import temporal.core.model.TemporalGraph;
import temporal.expansion.StaticExpansionBuilder;
import temporal.expansion.TimeWindow;

/**
 * Δ-differential tree-width: the tree-width of the width-Δ differential at every valid start
 * time {@code t0 in [0, L - Δ]}, and the minimum over them.
 *
 * <p>Windows are independent. In parallel mode they are computed on a {@link ForkJoinPool} and
 * reassembled in ascending start order.
 */
public final class DifferentialTreewidth {
  private static final Logger LOG = LoggerFactory.getLogger(DifferentialTreewidth.class);

  /** Execution settings for the aggregate. */
  public static final class Config {
    boolean parallel = false;
    int parallelism = Runtime.getRuntime().availableProcessors();

    public static Config sequential() {
      return new Config();
    }

    public static Config parallel(int parallelism) {
      if (parallelism < 1) {
        throw new IllegalArgumentException("parallelism must be at least 1");
      }
      Config c = new Config();
      c.parallel = true;
      c.parallelism = parallelism;
      return c;
    }
  }

  private final StaticExpansionBuilder builder;
  private final TreewidthEngine engine;
  private final Config config;

  public DifferentialTreewidth(TreewidthEngine engine, Config config) {
    this.builder = new StaticExpansionBuilder();
    this.engine = Objects.requireNonNull(engine, "engine");
    this.config = Objects.requireNonNull(config, "config");
  }

  public DifferentialTreewidth() {
    this(new TreewidthEngine(), Config.sequential());
  }

  /**
   * @throws InvalidWindowException if {@code delta < 1} or {@code delta} exceeds the lifetime
   */
  public DifferentialTreewidthReport compute(TemporalGraph graph, int delta) {
    Objects.requireNonNull(graph, "graph");
    if (delta < 1) {
      throw new InvalidWindowException("delta", delta, "delta must be >= 1, got " + delta);
    }
    if (delta > graph.lifetime()) {
      throw new InvalidWindowException(
          "delta",
          delta,
          "delta=" + delta + " out of range for lifetime=" + graph.lifetime());
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    int lastStart = graph.lifetime() - delta;
    List<WindowTreewidth> perStart;
    if (config.parallel) {
      ForkJoinPool pool =
          config.parallelism == ForkJoinPool.getCommonPoolParallelism()
              ? ForkJoinPool.commonPool()
              : new ForkJoinPool(config.parallelism);
      try {
        perStart =
            pool.submit(
                    () ->
                        IntStream.rangeClosed(0, lastStart)
                            .parallel()
                            .mapToObj(t0 -> window(graph, t0, delta))
                            .toList())
                .join();
      } finally {
        if (pool != ForkJoinPool.commonPool()) {
          pool.shutdown();
        }
      }
      perStart =
          perStart.stream().sorted(Comparator.comparingInt(WindowTreewidth::start)).toList();
    } else {
      perStart =
          IntStream.rangeClosed(0, lastStart).mapToObj(t0 -> window(graph, t0, delta)).toList();
    }

    DifferentialTreewidthReport report = new DifferentialTreewidthReport(delta, perStart);
    LOG.debug(
        "dtw_{} = {} over {} windows in {}",
        delta,
        report.minimum(),
        perStart.size(),
        stopwatch.stop());
    return report;
  }

  private WindowTreewidth window(TemporalGraph graph, int start, int delta) {
    TreewidthReport report = engine.treewidth(builder.expand(graph, TimeWindow.of(start, delta)));
    return new WindowTreewidth(start, report);
  }
}

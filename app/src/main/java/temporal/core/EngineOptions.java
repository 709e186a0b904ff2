package temporal.core;

import temporal.treewidth.DifferentialTreewidth;
import temporal.treewidth.TreewidthEngine;

/**
 * Tunables of the engine. {@link #fromSystemProperties()} reads overrides from {@code
 * temporal.exactNodeLimit}, {@code temporal.parallel} and {@code temporal.parallelism}.
 */
public record EngineOptions(int exactNodeLimit, boolean parallel, int parallelism) {

  static final String EXACT_NODE_LIMIT_PROPERTY = "temporal.exactNodeLimit";
  static final String PARALLEL_PROPERTY = "temporal.parallel";
  static final String PARALLELISM_PROPERTY = "temporal.parallelism";

  public static EngineOptions defaults() {
    return new EngineOptions(
        TreewidthEngine.DEFAULT_EXACT_NODE_LIMIT,
        false,
        Runtime.getRuntime().availableProcessors());
  }

  /**
   * Caps the exact limit at {@link TreewidthEngine#HARD_EXACT_NODE_LIMIT}; a negative limit or a
   * non-positive parallelism falls back to the default.
   */
  public static EngineOptions normalize(EngineOptions options) {
    if (options == null) {
      return defaults();
    }
    int exactNodeLimit =
        options.exactNodeLimit() >= 0
            ? Math.min(options.exactNodeLimit(), TreewidthEngine.HARD_EXACT_NODE_LIMIT)
            : defaults().exactNodeLimit();
    int parallelism = options.parallelism() > 0 ? options.parallelism() : defaults().parallelism();
    return new EngineOptions(exactNodeLimit, options.parallel(), parallelism);
  }

  public static EngineOptions fromSystemProperties() {
    EngineOptions defaults = defaults();
    int exactNodeLimit = intProperty(EXACT_NODE_LIMIT_PROPERTY, defaults.exactNodeLimit());
    String parallelValue = System.getProperty(PARALLEL_PROPERTY);
    boolean parallel =
        parallelValue != null ? Boolean.parseBoolean(parallelValue.trim()) : defaults.parallel();
    int parallelism = intProperty(PARALLELISM_PROPERTY, defaults.parallelism());
    return normalize(new EngineOptions(exactNodeLimit, parallel, parallelism));
  }

  public EngineOptions withExactNodeLimit(int limit) {
    return new EngineOptions(limit, parallel, parallelism);
  }

  public EngineOptions withParallel(boolean enabled) {
    return new EngineOptions(exactNodeLimit, enabled, parallelism);
  }

  TreewidthEngine treewidthEngine() {
    return new TreewidthEngine(exactNodeLimit);
  }

  DifferentialTreewidth.Config differentialConfig() {
    return parallel
        ? DifferentialTreewidth.Config.parallel(parallelism)
        : DifferentialTreewidth.Config.sequential();
  }

  private static int intProperty(String name, int fallback) {
    String value = System.getProperty(name);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, ex);
    }
  }
}

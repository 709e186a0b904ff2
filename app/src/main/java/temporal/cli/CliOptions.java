package temporal.cli;

import java.nio.file.Path;
import temporal.generator.RandomGraphConfig;

record CliOptions(
    Path graphFile,
    Path outFile,
    int vertices,
    int snapshots,
    double probability,
    Long seed,
    Integer start,
    Integer delta,
    Integer exactLimit,
    boolean parallel) {

  static final int DEFAULT_START = 0;
  static final int DEFAULT_DELTA = 2;

  CliOptions {
    if (exactLimit != null && exactLimit < 0) {
      throw new IllegalArgumentException("--exact-limit must be non-negative");
    }
  }

  boolean hasWindow() {
    return start != null || delta != null;
  }

  int startOrDefault() {
    return start != null ? start : DEFAULT_START;
  }

  int deltaOrDefault() {
    return delta != null ? delta : DEFAULT_DELTA;
  }

  Path requireGraphFile() {
    if (graphFile == null) {
      throw new IllegalArgumentException("Missing required option --graph");
    }
    return graphFile;
  }

  RandomGraphConfig randomGraphConfig() {
    return new RandomGraphConfig(vertices, snapshots, probability, seed);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path graphFile;
    private Path outFile;
    private int vertices = RandomGraphConfig.DEFAULT_VERTICES;
    private int snapshots = RandomGraphConfig.DEFAULT_LIFETIME;
    private double probability = RandomGraphConfig.DEFAULT_EDGE_PROBABILITY;
    private Long seed;
    private Integer start;
    private Integer delta;
    private Integer exactLimit;
    private boolean parallel;

    Builder graphFile(Path graphFile) {
      this.graphFile = graphFile;
      return this;
    }

    Builder outFile(Path outFile) {
      this.outFile = outFile;
      return this;
    }

    Builder vertices(int vertices) {
      this.vertices = vertices;
      return this;
    }

    Builder snapshots(int snapshots) {
      this.snapshots = snapshots;
      return this;
    }

    Builder probability(double probability) {
      this.probability = probability;
      return this;
    }

    Builder seed(Long seed) {
      this.seed = seed;
      return this;
    }

    Builder start(Integer start) {
      this.start = start;
      return this;
    }

    Builder delta(Integer delta) {
      this.delta = delta;
      return this;
    }

    Builder exactLimit(Integer exactLimit) {
      this.exactLimit = exactLimit;
      return this;
    }

    Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          graphFile,
          outFile,
          vertices,
          snapshots,
          probability,
          seed,
          start,
          delta,
          exactLimit,
          parallel);
    }
  }
}

package temporal.generator;

import java.util.Random;
import temporal.core.InvalidParametersException;

/**
 * Parameters of an Erdős–Rényi temporal graph: {@code vertexCount} vertices, {@code lifetime}
 * snapshots, edge probability {@code edgeProbability} and an optional seed.
 */
public record RandomGraphConfig(int vertexCount, int lifetime, double edgeProbability, Long seed) {

  public static final int DEFAULT_VERTICES = 10;
  public static final int DEFAULT_LIFETIME = 5;
  public static final double DEFAULT_EDGE_PROBABILITY = 0.2;

  public RandomGraphConfig {
    if (vertexCount < 1) {
      throw new InvalidParametersException(
          "num_nodes", vertexCount, "vertexCount must be at least 1, got " + vertexCount);
    }
    if (lifetime < 1) {
      throw new InvalidParametersException(
          "num_snapshots", lifetime, "lifetime must be at least 1, got " + lifetime);
    }
    if (Double.isNaN(edgeProbability) || edgeProbability < 0.0 || edgeProbability > 1.0) {
      throw new InvalidParametersException(
          "edge_prob",
          edgeProbability,
          "edgeProbability must lie in [0, 1], got " + edgeProbability);
    }
  }

  public static RandomGraphConfig defaults() {
    return new RandomGraphConfig(
        DEFAULT_VERTICES, DEFAULT_LIFETIME, DEFAULT_EDGE_PROBABILITY, null);
  }

  public Random createRandom() {
    return seed != null ? new Random(seed) : new Random();
  }
}

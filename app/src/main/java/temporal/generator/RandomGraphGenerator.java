package temporal.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.core.model.TemporalGraph;
import temporal.core.model.VertexPair;

/**
 * Draws temporal graphs whose snapshots are independent Erdős–Rényi samples. Pairs {@code u < v}
 * are visited in lexicographic order and each is kept when the next draw is below the edge
 * probability, so a seeded config always yields the same graph.
 */
public final class RandomGraphGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(RandomGraphGenerator.class);

  public TemporalGraph generate(RandomGraphConfig config) {
    Objects.requireNonNull(config, "config");
    Random random = config.createRandom();
    int n = config.vertexCount();
    double p = config.edgeProbability();

    List<List<VertexPair>> snapshots = new ArrayList<>(config.lifetime());
    for (int t = 0; t < config.lifetime(); t++) {
      List<VertexPair> edges = new ArrayList<>();
      for (int u = 0; u < n; u++) {
        for (int v = u + 1; v < n; v++) {
          if (random.nextDouble() < p) {
            edges.add(VertexPair.of(u, v));
          }
        }
      }
      snapshots.add(edges);
    }
    TemporalGraph graph = TemporalGraph.of(IntStream.range(0, n).boxed().toList(), snapshots);
    LOG.debug("Generated {} with p={} seed={}", graph, p, config.seed());
    return graph;
  }

  public TemporalGraph generate(int vertexCount, int lifetime, double edgeProbability) {
    return generate(new RandomGraphConfig(vertexCount, lifetime, edgeProbability, null));
  }
}

package temporal.generator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import temporal.core.InvalidParametersException;
import temporal.core.model.TemporalGraph;
import temporal.core.model.VertexPair;

final class RandomGraphGeneratorTest {
  private final RandomGraphGenerator generator = new RandomGraphGenerator();

  @Test
  void zeroProbabilityGivesEmptySnapshots() {
    TemporalGraph graph = generator.generate(6, 4, 0.0);

    assertEquals(6, graph.vertexCount());
    assertEquals(4, graph.lifetime());
    assertEquals(List.of(0, 0, 0, 0), graph.snapshotEdgeCounts());
  }

  @Test
  void fullProbabilityGivesCompleteSnapshots() {
    TemporalGraph graph = generator.generate(5, 3, 1.0);

    assertEquals(List.of(10, 10, 10), graph.snapshotEdgeCounts());
    assertEquals(VertexPair.of(0, 1), graph.snapshot(0).get(0), "pairs in lexicographic order");
  }

  @Test
  void seedFixesTheGraph() {
    RandomGraphConfig config = new RandomGraphConfig(9, 4, 0.3, 1234L);

    assertEquals(generator.generate(config), generator.generate(config));
  }

  @Test
  void edgesAreCanonicalAndInRange() {
    TemporalGraph graph = generator.generate(new RandomGraphConfig(7, 5, 0.5, 5L));
    for (List<VertexPair> snapshot : graph.snapshots()) {
      for (VertexPair pair : snapshot) {
        assertTrue(pair.first() < pair.second(), "generated pairs have u < v");
        assertTrue(pair.second() < 7);
      }
    }
  }

  @Test
  void singleVertexHasNoEdges() {
    assertEquals(0, generator.generate(1, 2, 1.0).totalEdgeCount());
  }

  @Test
  void rejectsInvalidParameters() {
    assertEquals(
        "num_nodes",
        assertThrows(InvalidParametersException.class, () -> generator.generate(0, 3, 0.5))
            .field());
    assertEquals(
        "num_snapshots",
        assertThrows(InvalidParametersException.class, () -> generator.generate(3, 0, 0.5))
            .field());
    assertEquals(
        "edge_prob",
        assertThrows(InvalidParametersException.class, () -> generator.generate(3, 3, 1.5))
            .field());
    assertThrows(InvalidParametersException.class, () -> generator.generate(3, 3, -0.1));
    assertThrows(InvalidParametersException.class, () -> generator.generate(3, 3, Double.NaN));
  }

  @Test
  void defaultsAreValid() {
    RandomGraphConfig defaults = RandomGraphConfig.defaults();

    assertEquals(10, defaults.vertexCount());
    assertEquals(5, defaults.lifetime());
    assertEquals(0.2, defaults.edgeProbability());
  }
}

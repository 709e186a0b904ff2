package temporal.expansion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import temporal.core.InvalidWindowException;
import temporal.core.model.TemporalGraph;
import temporal.generator.RandomGraphConfig;
import temporal.generator.RandomGraphGenerator;
import temporal.io.ExpansionGraphJson;
import temporal.testing.Graphs;

final class StaticExpansionBuilderTest {
  private final StaticExpansionBuilder builder = new StaticExpansionBuilder();

  @Test
  void fullExpansionOfSmallScenario() {
    ExpansionGraph expansion = builder.expand(Graphs.pathAndMatching());

    assertEquals(new ExpansionSummary(8, 4, 4), expansion.summary());
    assertEquals(TimeWindow.of(0, 2), expansion.window());
  }

  @Test
  void nodesAreOrderedByTimeThenVertex() {
    TemporalGraph graph = TemporalGraph.of(List.of(5, 1, 3), List.of(List.of(), List.of()));
    ExpansionGraph expansion = builder.expand(graph);

    List<String> ids = expansion.nodes().stream().map(ExpansionNode::id).toList();
    assertEquals(List.of("1_t0", "3_t0", "5_t0", "1_t1", "3_t1", "5_t1"), ids);
    assertEquals(4, expansion.nodeIndex(3, 1));
    assertEquals(-1, expansion.nodeIndex(3, 2));
  }

  @Test
  void blackEdgesFollowSnapshotOrderAndRedEdgesLinkConsecutiveTimes() {
    ExpansionGraph expansion = builder.expand(Graphs.pathAndMatching());

    ExpansionEdge second = expansion.blackEdges().get(1);
    assertEquals("b_1", second.id());
    assertEquals("1_t0", expansion.node(second.source()).id());
    assertEquals("2_t0", expansion.node(second.target()).id());

    for (ExpansionEdge red : expansion.redEdges()) {
      ExpansionNode source = expansion.node(red.source());
      ExpansionNode target = expansion.node(red.target());
      assertEquals(source.vertex(), target.vertex(), "red edges keep the vertex");
      assertEquals(source.time() + 1, target.time(), "red edges point forward in time");
    }
    assertEquals("r_3", expansion.redEdges().get(3).id());
  }

  @Test
  void countsMatchSnapshotsForRandomGraphs() {
    RandomGraphGenerator generator = new RandomGraphGenerator();
    for (long seed = 0; seed < 10; seed++) {
      TemporalGraph graph = generator.generate(new RandomGraphConfig(6, 4, 0.4, seed));
      ExpansionSummary summary = builder.expand(graph).summary();

      assertEquals(6 * 4, summary.numNodes());
      assertEquals(graph.totalEdgeCount(), summary.numBlackEdges());
      assertEquals(6 * 3, summary.numRedEdges());
    }
  }

  @Test
  void windowCountsOnlyCoveredSnapshots() {
    TemporalGraph graph =
        Graphs.of(
            3,
            new int[][] {{0, 1}},
            new int[][] {{0, 1}, {1, 2}},
            new int[][] {{0, 2}, {1, 2}, {0, 1}});
    ExpansionGraph expansion = builder.expand(graph, TimeWindow.of(1, 2));

    assertEquals(new ExpansionSummary(6, 5, 3), expansion.summary());
    assertEquals(1, expansion.node(0).time());
  }

  @Test
  void singleSnapshotWindowHasNoRedEdges() {
    ExpansionGraph expansion = builder.expand(Graphs.pathAndMatching(), 1, 1);

    assertEquals(new ExpansionSummary(4, 2, 0), expansion.summary());
  }

  @Test
  void repeatedCallsAreIdentical() {
    TemporalGraph graph =
        new RandomGraphGenerator().generate(new RandomGraphConfig(7, 5, 0.3, 11L));

    String first = ExpansionGraphJson.write(builder.expand(graph, TimeWindow.of(1, 3)));
    String second = ExpansionGraphJson.write(builder.expand(graph, TimeWindow.of(1, 3)));
    assertEquals(first, second);
  }

  @Test
  void rejectsWindowsOutsideLifetime() {
    TemporalGraph graph = Graphs.pathAndMatching();

    InvalidWindowException tooWide =
        assertThrows(InvalidWindowException.class, () -> builder.expand(graph, 1, 2));
    assertEquals("delta", tooWide.field());
    InvalidWindowException negative =
        assertThrows(InvalidWindowException.class, () -> builder.expand(graph, -1, 1));
    assertEquals("t", negative.field());
    assertThrows(InvalidWindowException.class, () -> builder.expand(graph, 0, 0));
    assertThrows(InvalidWindowException.class, () -> builder.expand(graph, 0, 3));
  }

  @Test
  void undirectedAdjacencyIsSymmetric() {
    ExpansionGraph expansion = builder.expand(Graphs.pathAndMatching());
    var adjacency = expansion.undirectedAdjacency();

    for (int v = 0; v < adjacency.length; v++) {
      for (int w = adjacency[v].nextSetBit(0); w >= 0; w = adjacency[v].nextSetBit(w + 1)) {
        assertTrue(adjacency[w].get(v), "edge " + v + "-" + w + " must be mirrored");
      }
    }
  }
}

package temporal.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import temporal.core.InvalidGraphException;
import temporal.testing.Graphs;

final class TemporalGraphTest {

  @Test
  void exposesLifetimeAndDerivedCounts() {
    TemporalGraph graph = Graphs.pathAndMatching();

    assertEquals(4, graph.vertexCount());
    assertEquals(2, graph.lifetime());
    assertEquals(List.of(2, 2), graph.snapshotEdgeCounts());
    assertEquals(4, graph.totalEdgeCount());
    assertEquals(3, graph.unionEdges().size(), "{0,1} appears in both snapshots");
  }

  @Test
  void indexesVerticesInAscendingOrder() {
    TemporalGraph graph = TemporalGraph.of(List.of(7, 2, 5), List.of(List.of()));

    assertEquals(List.of(7, 2, 5), graph.vertices(), "supplied order is kept");
    assertEquals(0, graph.indexOf(2));
    assertEquals(1, graph.indexOf(5));
    assertEquals(2, graph.indexOf(7));
    assertEquals(-1, graph.indexOf(3));
  }

  @Test
  void pairsIgnoreOrientation() {
    assertEquals(VertexPair.of(1, 2), VertexPair.of(2, 1));
    assertEquals(VertexPair.of(1, 2).hashCode(), VertexPair.of(2, 1).hashCode());
    assertEquals(3, VertexPair.of(3, 1).other(1));
  }

  @Test
  void rejectsDuplicateVertices() {
    InvalidGraphException ex =
        assertThrows(
            InvalidGraphException.class,
            () -> TemporalGraph.of(List.of(0, 1, 1), List.of(List.of())));
    assertEquals("vertices", ex.field());
    assertEquals(1, ex.value());
  }

  @Test
  void rejectsNegativeVertices() {
    assertThrows(
        InvalidGraphException.class,
        () -> TemporalGraph.of(List.of(0, -1), List.of(List.of())));
  }

  @Test
  void rejectsEmptySnapshotList() {
    InvalidGraphException ex =
        assertThrows(InvalidGraphException.class, () -> TemporalGraph.of(List.of(0, 1), List.of()));
    assertEquals("snapshots", ex.field());
  }

  @Test
  void rejectsUnknownEndpoints() {
    InvalidGraphException ex =
        assertThrows(
            InvalidGraphException.class,
            () -> TemporalGraph.of(List.of(0, 1), List.of(List.of(VertexPair.of(0, 4)))));
    assertEquals("snapshots[0]", ex.field());
  }

  @Test
  void rejectsSelfLoops() {
    assertThrows(
        InvalidGraphException.class,
        () -> TemporalGraph.of(List.of(0, 1), List.of(List.of(), List.of(VertexPair.of(1, 1)))));
  }

  @Test
  void rejectsRepeatedPairWithinSnapshot() {
    assertThrows(
        InvalidGraphException.class,
        () ->
            TemporalGraph.of(
                List.of(0, 1), List.of(List.of(VertexPair.of(0, 1), VertexPair.of(1, 0)))));
  }

  @Test
  void copiesInputCollections() {
    List<VertexPair> snapshot = new ArrayList<>(List.of(VertexPair.of(0, 1)));
    List<List<VertexPair>> snapshots = new ArrayList<>(List.of(snapshot));
    TemporalGraph graph = TemporalGraph.of(List.of(0, 1, 2), snapshots);

    snapshot.add(VertexPair.of(1, 2));
    snapshots.add(List.of());

    assertEquals(1, graph.lifetime());
    assertEquals(1, graph.snapshot(0).size());
    assertThrows(UnsupportedOperationException.class, () -> graph.snapshots().add(List.of()));
  }

  @Test
  void emptyGraphIsValid() {
    TemporalGraph graph = TemporalGraph.of(List.of(), List.of(List.of()));
    assertEquals(0, graph.vertexCount());
    assertTrue(graph.unionEdges().isEmpty());
    assertFalse(graph.hasVertex(0));
  }
}

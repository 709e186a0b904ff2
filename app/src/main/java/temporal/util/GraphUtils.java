package temporal.util;

import java.util.BitSet;
import java.util.Objects;
import temporal.core.model.TemporalGraph;
import temporal.core.model.VertexPair;

/** Adjacency helpers shared by the analyzers. */
public final class GraphUtils {
  private GraphUtils() {}

  /**
   * Adjacency of snapshot {@code t} indexed by ascending-id vertex rank ({@link
   * TemporalGraph#indexOf(int)}).
   */
  public static BitSet[] snapshotAdjacency(TemporalGraph graph, int t) {
    Objects.requireNonNull(graph, "graph");
    BitSet[] adjacency = emptyAdjacency(graph.vertexCount());
    for (VertexPair pair : graph.snapshot(t)) {
      int u = graph.indexOf(pair.first());
      int v = graph.indexOf(pair.second());
      adjacency[u].set(v);
      adjacency[v].set(u);
    }
    return adjacency;
  }

  public static BitSet[] emptyAdjacency(int size) {
    BitSet[] adjacency = new BitSet[size];
    for (int i = 0; i < size; i++) {
      adjacency[i] = new BitSet(size);
    }
    return adjacency;
  }

  /** Complete graph on {@code size} nodes. */
  public static BitSet[] completeAdjacency(int size) {
    BitSet[] adjacency = emptyAdjacency(size);
    for (int i = 0; i < size; i++) {
      adjacency[i].set(0, size);
      adjacency[i].clear(i);
    }
    return adjacency;
  }

  public static void addEdge(BitSet[] adjacency, int u, int v) {
    if (u == v) {
      throw new IllegalArgumentException("Self-loop on node " + u);
    }
    adjacency[u].set(v);
    adjacency[v].set(u);
  }

  /** Number of undirected edges, assuming a symmetric adjacency. */
  public static int edgeCount(BitSet[] adjacency) {
    int twice = 0;
    for (BitSet neighbours : adjacency) {
      twice += neighbours.cardinality();
    }
    return twice / 2;
  }
}

package temporal.expansion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Static expansion of a temporal graph over one time window.
 *
 * <p>Nodes are numbered densely: node {@code (v, t)} has index {@code (t - start) * n + rank(v)}
 * where {@code rank} is the ascending-id position of {@code v}. Black edges come first in
 * enumeration order, then red edges.
 */
public final class ExpansionGraph {
  private final int[] vertexIds;
  private final TimeWindow window;
  private final List<ExpansionNode> nodes;
  private final List<ExpansionEdge> blackEdges;
  private final List<ExpansionEdge> redEdges;

  ExpansionGraph(
      int[] vertexIds,
      TimeWindow window,
      List<ExpansionNode> nodes,
      List<ExpansionEdge> blackEdges,
      List<ExpansionEdge> redEdges) {
    this.vertexIds = vertexIds.clone();
    this.window = Objects.requireNonNull(window, "window");
    this.nodes = List.copyOf(nodes);
    this.blackEdges = List.copyOf(blackEdges);
    this.redEdges = List.copyOf(redEdges);
  }

  public TimeWindow window() {
    return window;
  }

  public int vertexCount() {
    return vertexIds.length;
  }

  public List<ExpansionNode> nodes() {
    return nodes;
  }

  public ExpansionNode node(int index) {
    return nodes.get(index);
  }

  public int nodeCount() {
    return nodes.size();
  }

  /** Index of node {@code (vertex, time)}, or {@code -1} when outside this expansion. */
  public int nodeIndex(int vertex, int time) {
    if (!window.contains(time)) {
      return -1;
    }
    int rank = Arrays.binarySearch(vertexIds, vertex);
    if (rank < 0) {
      return -1;
    }
    return (time - window.start()) * vertexIds.length + rank;
  }

  public List<ExpansionEdge> blackEdges() {
    return blackEdges;
  }

  public List<ExpansionEdge> redEdges() {
    return redEdges;
  }

  /** All edges, black before red. */
  public List<ExpansionEdge> edges() {
    List<ExpansionEdge> all = new ArrayList<>(blackEdges.size() + redEdges.size());
    all.addAll(blackEdges);
    all.addAll(redEdges);
    return all;
  }

  public int edgeCount() {
    return blackEdges.size() + redEdges.size();
  }

  public ExpansionSummary summary() {
    return new ExpansionSummary(nodes.size(), blackEdges.size(), redEdges.size());
  }

  /**
   * Undirected adjacency over node indices with red edges treated as undirected. Each call returns
   * fresh sets the caller may mutate.
   */
  public BitSet[] undirectedAdjacency() {
    BitSet[] adjacency = new BitSet[nodes.size()];
    for (int i = 0; i < adjacency.length; i++) {
      adjacency[i] = new BitSet(adjacency.length);
    }
    for (ExpansionEdge edge : blackEdges) {
      link(adjacency, edge);
    }
    for (ExpansionEdge edge : redEdges) {
      link(adjacency, edge);
    }
    return adjacency;
  }

  private static void link(BitSet[] adjacency, ExpansionEdge edge) {
    adjacency[edge.source()].set(edge.target());
    adjacency[edge.target()].set(edge.source());
  }

  @Override
  public String toString() {
    return "ExpansionGraph{window=" + window + ", " + summary() + "}";
  }
}

package temporal.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.core.model.TemporalGraph;
import temporal.core.model.TwinPair;
import temporal.util.BitsetUtils;
import temporal.util.GraphUtils;

/**
 * Finds eternal twins: vertex pairs that are twins in every snapshot of the lifetime.
 *
 * <p>{@code u} and {@code v} are twins at time {@code t} when {@code N_t(u) \ {v} = N_t(v) \ {u}}.
 * Whether {@code u} and {@code v} are adjacent at {@code t} does not matter.
 */
public final class TwinDetector {
  private static final Logger LOG = LoggerFactory.getLogger(TwinDetector.class);

  /**
   * All eternal-twin pairs of {@code graph}, ordered by {@code u} then {@code v}. The result is
   * empty for graphs with fewer than two vertices.
   */
  public Set<TwinPair> detect(TemporalGraph graph) {
    Objects.requireNonNull(graph, "graph");
    int n = graph.vertexCount();
    int[] ids = graph.sortedVertices();

    // Candidate pairs as rank pairs, pruned snapshot by snapshot.
    List<int[]> candidates = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        candidates.add(new int[] {i, j});
      }
    }

    for (int t = 0; t < graph.lifetime() && !candidates.isEmpty(); t++) {
      BitSet[] adjacency = GraphUtils.snapshotAdjacency(graph, t);
      candidates.removeIf(pair -> !twins(adjacency, pair[0], pair[1]));
      LOG.debug("After snapshot {}: {} candidate twin pairs", t, candidates.size());
    }

    Set<TwinPair> result = new LinkedHashSet<>();
    for (int[] pair : candidates) {
      result.add(new TwinPair(ids[pair[0]], ids[pair[1]]));
    }
    return Collections.unmodifiableSet(result);
  }

  public int count(TemporalGraph graph) {
    return detect(graph).size();
  }

  /** Whether {@code u} and {@code v} are twins in snapshot {@code t}. */
  public boolean areTwinsAt(TemporalGraph graph, int u, int v, int t) {
    Objects.requireNonNull(graph, "graph");
    int i = requireVertex(graph, u);
    int j = requireVertex(graph, v);
    if (i == j) {
      return false;
    }
    return twins(GraphUtils.snapshotAdjacency(graph, t), i, j);
  }

  /** Whether {@code u} and {@code v} are twins in every snapshot. */
  public boolean areEternalTwins(TemporalGraph graph, int u, int v) {
    Objects.requireNonNull(graph, "graph");
    int i = requireVertex(graph, u);
    int j = requireVertex(graph, v);
    if (i == j) {
      return false;
    }
    for (int t = 0; t < graph.lifetime(); t++) {
      if (!twins(GraphUtils.snapshotAdjacency(graph, t), i, j)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Partitions the vertices into twin classes for snapshot {@code t}. Classes list vertex ids in
   * ascending order and are ordered by their smallest member.
   *
   * <p>Twin-at-{@code t} is an equivalence relation: a true-twin pair and a false-twin pair can
   * never share a vertex, so comparing against the first member of each class is exact.
   */
  public List<List<Integer>> twinClassesAt(TemporalGraph graph, int t) {
    Objects.requireNonNull(graph, "graph");
    BitSet[] adjacency = GraphUtils.snapshotAdjacency(graph, t);
    int[] ids = graph.sortedVertices();
    List<List<Integer>> classes = new ArrayList<>();
    List<Integer> representatives = new ArrayList<>();
    for (int i = 0; i < ids.length; i++) {
      int target = -1;
      for (int c = 0; c < representatives.size(); c++) {
        if (twins(adjacency, representatives.get(c), i)) {
          target = c;
          break;
        }
      }
      if (target < 0) {
        representatives.add(i);
        classes.add(new ArrayList<>());
        target = classes.size() - 1;
      }
      classes.get(target).add(ids[i]);
    }
    return classes.stream().map(List::copyOf).toList();
  }

  private static boolean twins(BitSet[] adjacency, int i, int j) {
    return BitsetUtils.without(adjacency[i], j).equals(BitsetUtils.without(adjacency[j], i));
  }

  private static int requireVertex(TemporalGraph graph, int vertex) {
    int index = graph.indexOf(vertex);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown vertex " + vertex);
    }
    return index;
  }
}

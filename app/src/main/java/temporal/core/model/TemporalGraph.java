package temporal.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import temporal.core.InvalidGraphException;

/**
 * Immutable temporal graph: a fixed vertex set and one undirected edge set per time step.
 *
 * <p>Instances are only created through {@link #of(List, List)}, which validates the description
 * and copies every collection. Vertices keep the order they were supplied in; {@link
 * #sortedVertices()} and {@link #indexOf(int)} give the dense ascending-id numbering used by the
 * analyzers.
 */
public final class TemporalGraph {
  private final List<Integer> vertices;
  private final List<List<VertexPair>> snapshots;
  private final int[] sorted;
  private final Map<Integer, Integer> indexByVertex;

  private TemporalGraph(List<Integer> vertices, List<List<VertexPair>> snapshots) {
    this.vertices = vertices;
    this.snapshots = snapshots;
    this.sorted = vertices.stream().mapToInt(Integer::intValue).sorted().toArray();
    Map<Integer, Integer> index = new HashMap<>();
    for (int i = 0; i < sorted.length; i++) {
      index.put(sorted[i], i);
    }
    this.indexByVertex = Collections.unmodifiableMap(index);
  }

  /**
   * Validates and builds a temporal graph.
   *
   * @throws InvalidGraphException on duplicate or negative vertices, an empty snapshot list,
   *     unknown endpoints, self-loops or a pair repeated within one snapshot
   */
  public static TemporalGraph of(List<Integer> vertices, List<List<VertexPair>> snapshots) {
    Objects.requireNonNull(vertices, "vertices");
    Objects.requireNonNull(snapshots, "snapshots");

    Set<Integer> known = new LinkedHashSet<>();
    for (Integer vertex : vertices) {
      if (vertex == null || vertex < 0) {
        throw new InvalidGraphException(
            "vertices", vertex, "Vertex ids must be non-negative integers, found " + vertex);
      }
      if (!known.add(vertex)) {
        throw new InvalidGraphException("vertices", vertex, "Duplicate vertex " + vertex);
      }
    }

    if (snapshots.isEmpty()) {
      throw new InvalidGraphException(
          "snapshots", 0, "A temporal graph needs at least one snapshot");
    }

    List<List<VertexPair>> copies = new ArrayList<>(snapshots.size());
    for (int t = 0; t < snapshots.size(); t++) {
      List<VertexPair> snapshot = snapshots.get(t);
      if (snapshot == null) {
        throw new InvalidGraphException("snapshots[" + t + "]", null, "Snapshot " + t + " is null");
      }
      Set<VertexPair> seen = new HashSet<>();
      for (VertexPair pair : snapshot) {
        String field = "snapshots[" + t + "]";
        if (pair == null) {
          throw new InvalidGraphException(field, null, "Null edge in snapshot " + t);
        }
        if (pair.isLoop()) {
          throw new InvalidGraphException(
              field, pair, "Self-loop " + pair + " in snapshot " + t);
        }
        if (!known.contains(pair.first()) || !known.contains(pair.second())) {
          throw new InvalidGraphException(
              field, pair, "Edge " + pair + " in snapshot " + t + " references an unknown vertex");
        }
        if (!seen.add(pair)) {
          throw new InvalidGraphException(
              field, pair, "Edge " + pair + " appears more than once in snapshot " + t);
        }
      }
      copies.add(List.copyOf(snapshot));
    }
    return new TemporalGraph(List.copyOf(known), Collections.unmodifiableList(copies));
  }

  public List<Integer> vertices() {
    return vertices;
  }

  public int vertexCount() {
    return vertices.size();
  }

  public boolean hasVertex(int vertex) {
    return indexByVertex.containsKey(vertex);
  }

  /** Vertex ids in ascending order. */
  public int[] sortedVertices() {
    return sorted.clone();
  }

  /** Position of {@code vertex} in ascending-id order, or {@code -1} when absent. */
  public int indexOf(int vertex) {
    Integer index = indexByVertex.get(vertex);
    return index == null ? -1 : index;
  }

  public int lifetime() {
    return snapshots.size();
  }

  public List<List<VertexPair>> snapshots() {
    return snapshots;
  }

  public List<VertexPair> snapshot(int t) {
    if (t < 0 || t >= snapshots.size()) {
      throw new IndexOutOfBoundsException("Snapshot " + t + " outside lifetime " + lifetime());
    }
    return snapshots.get(t);
  }

  public List<Integer> snapshotEdgeCounts() {
    return snapshots.stream().map(List::size).toList();
  }

  public int totalEdgeCount() {
    return snapshots.stream().mapToInt(List::size).sum();
  }

  /** Distinct pairs present in at least one snapshot, in first-appearance order. */
  public Set<VertexPair> unionEdges() {
    Set<VertexPair> union = new LinkedHashSet<>();
    snapshots.forEach(union::addAll);
    return Collections.unmodifiableSet(union);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TemporalGraph other)) {
      return false;
    }
    return vertices.equals(other.vertices) && snapshots.equals(other.snapshots);
  }

  @Override
  public int hashCode() {
    return Objects.hash(vertices, snapshots);
  }

  @Override
  public String toString() {
    return "TemporalGraph{n="
        + vertices.size()
        + ", lifetime="
        + snapshots.size()
        + ", edgesPerSnapshot="
        + Arrays.toString(snapshots.stream().mapToInt(List::size).toArray())
        + "}";
  }
}

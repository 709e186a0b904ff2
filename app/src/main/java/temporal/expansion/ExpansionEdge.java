package temporal.expansion;

import java.util.Objects;

/**
 * Edge of a static expansion between two node indices. Black edges are undirected; red edges
 * point from {@code (v,t)} to {@code (v,t+1)}.
 */
public record ExpansionEdge(int ordinal, int source, int target, EdgeType type) {

  public ExpansionEdge {
    Objects.requireNonNull(type, "type");
  }

  /** Stable string id: {@code b_<ordinal>} or {@code r_<ordinal>}. */
  public String id() {
    return (type == EdgeType.BLACK ? "b_" : "r_") + ordinal;
  }
}

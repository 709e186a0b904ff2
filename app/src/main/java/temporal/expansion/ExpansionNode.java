package temporal.expansion;

/** Time-stamped copy {@code (vertex, time)} of a temporal-graph vertex. */
public record ExpansionNode(int index, int vertex, int time) {

  /** Stable string id, e.g. {@code 3_t1}. */
  public String id() {
    return vertex + "_t" + time;
  }

  public String label() {
    return "v" + vertex;
  }
}

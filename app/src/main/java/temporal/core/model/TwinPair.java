package temporal.core.model;

/** Unordered pair of eternal twins, normalized so that {@code u < v}. */
public record TwinPair(int u, int v) implements Comparable<TwinPair> {

  public TwinPair {
    if (u == v) {
      throw new IllegalArgumentException("A vertex cannot be its own twin: " + u);
    }
    if (u > v) {
      int swap = u;
      u = v;
      v = swap;
    }
  }

  public boolean contains(int vertex) {
    return u == vertex || v == vertex;
  }

  @Override
  public int compareTo(TwinPair other) {
    int cmp = Integer.compare(u, other.u);
    return cmp != 0 ? cmp : Integer.compare(v, other.v);
  }
}

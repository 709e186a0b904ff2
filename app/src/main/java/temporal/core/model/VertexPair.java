package temporal.core.model;

/**
 * Unordered pair of distinct vertices, keeping the orientation it was first written in.
 *
 * <p>Equality and hashing ignore orientation, so {@code (1,2)} and {@code (2,1)} are the same pair.
 */
public final class VertexPair {
  private final int first;
  private final int second;

  private VertexPair(int first, int second) {
    this.first = first;
    this.second = second;
  }

  public static VertexPair of(int first, int second) {
    return new VertexPair(first, second);
  }

  public int first() {
    return first;
  }

  public int second() {
    return second;
  }

  public int low() {
    return Math.min(first, second);
  }

  public int high() {
    return Math.max(first, second);
  }

  public boolean isLoop() {
    return first == second;
  }

  public boolean contains(int vertex) {
    return first == vertex || second == vertex;
  }

  /** Returns the endpoint opposite {@code vertex}. */
  public int other(int vertex) {
    if (vertex == first) {
      return second;
    }
    if (vertex == second) {
      return first;
    }
    throw new IllegalArgumentException("Vertex " + vertex + " is not an endpoint of " + this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VertexPair other)) {
      return false;
    }
    return low() == other.low() && high() == other.high();
  }

  @Override
  public int hashCode() {
    return 31 * low() + high();
  }

  @Override
  public String toString() {
    return "{" + first + "," + second + "}";
  }
}

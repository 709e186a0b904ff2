package temporal.treewidth;

import java.util.BitSet;
import temporal.util.BitsetUtils;

/**
 * Working copy of an undirected graph that supports vertex elimination: removing a vertex turns
 * its remaining neighbourhood into a clique.
 */
final class EliminationGraph {
  private final BitSet[] adjacency;
  private final BitSet alive;

  EliminationGraph(BitSet[] adjacency) {
    this.adjacency = BitsetUtils.deepCopy(adjacency);
    this.alive = new BitSet(adjacency.length);
    this.alive.set(0, adjacency.length);
  }

  boolean isEmpty() {
    return alive.isEmpty();
  }

  /** Live vertex of minimum current degree; ties go to the lowest index. */
  int minDegreeVertex() {
    int best = -1;
    int bestDegree = Integer.MAX_VALUE;
    for (int v = alive.nextSetBit(0); v >= 0; v = alive.nextSetBit(v + 1)) {
      int d = adjacency[v].cardinality();
      if (d < bestDegree) {
        best = v;
        bestDegree = d;
      }
    }
    return best;
  }

  /**
   * Eliminates {@code v} and returns its bag: {@code v} plus its neighbours at elimination time.
   */
  BitSet eliminate(int v) {
    if (!alive.get(v)) {
      throw new IllegalStateException("Vertex " + v + " already eliminated");
    }
    BitSet neighbours = adjacency[v];
    for (int a = neighbours.nextSetBit(0); a >= 0; a = neighbours.nextSetBit(a + 1)) {
      adjacency[a].or(neighbours);
      adjacency[a].clear(a);
      adjacency[a].clear(v);
    }
    BitSet bag = (BitSet) neighbours.clone();
    bag.set(v);
    adjacency[v] = new BitSet();
    alive.clear(v);
    return bag;
  }
}

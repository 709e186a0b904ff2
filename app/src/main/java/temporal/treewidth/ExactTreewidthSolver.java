package temporal.treewidth;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Exact tree-width by dynamic programming over eliminated vertex sets.
 *
 * <p>For a set {@code S} eliminated first, {@code TW(S) = min over v in S of max(TW(S - v),
 * |Q(S - v, v)|)}, where {@code Q(S, v)} is the set of vertices outside {@code S + v} reachable
 * from {@code v} through {@code S}. This covers every elimination ordering while visiting each
 * subset once, so memory and time grow as {@code 2^n}; callers must stay within {@link
 * #HARD_NODE_LIMIT}.
 */
final class ExactTreewidthSolver {
  /** Largest graph the solver accepts, whatever the configured limit. */
  static final int HARD_NODE_LIMIT = 20;

  record Solution(int width, List<Integer> eliminationOrder) {}

  private ExactTreewidthSolver() {}

  static Solution solve(BitSet[] adjacency) {
    int n = adjacency.length;
    if (n > HARD_NODE_LIMIT) {
      throw new IllegalArgumentException(
          "Exact solver limited to " + HARD_NODE_LIMIT + " nodes, got " + n);
    }
    int[] neighbours = new int[n];
    for (int v = 0; v < n; v++) {
      BitSet row = adjacency[v];
      for (int w = row.nextSetBit(0); w >= 0; w = row.nextSetBit(w + 1)) {
        neighbours[v] |= 1 << w;
      }
    }

    int full = (1 << n) - 1;
    int[] best = new int[full + 1];
    byte[] choice = new byte[full + 1];
    best[0] = -1;
    for (int set = 1; set <= full; set++) {
      int bestValue = Integer.MAX_VALUE;
      int bestVertex = -1;
      for (int rest = set; rest != 0; rest &= rest - 1) {
        int v = Integer.numberOfTrailingZeros(rest);
        int before = set & ~(1 << v);
        int value = Math.max(best[before], reachableOutside(neighbours, before, v));
        if (value < bestValue) {
          bestValue = value;
          bestVertex = v;
        }
      }
      best[set] = bestValue;
      choice[set] = (byte) bestVertex;
    }

    Deque<Integer> order = new ArrayDeque<>(n);
    for (int set = full; set != 0; set &= ~(1 << choice[set])) {
      order.addFirst((int) choice[set]);
    }
    return new Solution(Math.max(0, best[full]), List.copyOf(order));
  }

  /** {@code |Q(eliminated, v)|}: vertices outside {@code eliminated + v} reached through it. */
  private static int reachableOutside(int[] neighbours, int eliminated, int v) {
    int visited = 1 << v;
    int reached = 0;
    int frontier = 1 << v;
    while (frontier != 0) {
      int x = Integer.numberOfTrailingZeros(frontier);
      frontier &= frontier - 1;
      int next = neighbours[x];
      reached |= next & ~eliminated & ~(1 << v);
      int expand = next & eliminated & ~visited;
      visited |= expand;
      frontier |= expand;
    }
    return Integer.bitCount(reached);
  }
}

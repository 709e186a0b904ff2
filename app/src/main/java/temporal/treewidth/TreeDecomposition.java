package temporal.treewidth;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Tree decomposition derived from an elimination ordering. Bag {@code i} belongs to the {@code
 * i}-th eliminated vertex; its parent is the bag of the first vertex of that bag eliminated
 * afterwards. Bags without such a vertex hang off the last bag, which is the root.
 */
public final class TreeDecomposition {
  private final List<BitSet> bags;
  private final int[] parent;

  private TreeDecomposition(List<BitSet> bags, int[] parent) {
    this.bags = bags;
    this.parent = parent;
  }

  /** Replays {@code order} on {@code adjacency} and records the resulting bags. */
  public static TreeDecomposition fromOrdering(BitSet[] adjacency, List<Integer> order) {
    Objects.requireNonNull(adjacency, "adjacency");
    Objects.requireNonNull(order, "order");
    if (order.size() != adjacency.length) {
      throw new IllegalArgumentException(
          "Ordering covers " + order.size() + " of " + adjacency.length + " nodes");
    }
    int[] position = new int[adjacency.length];
    for (int i = 0; i < order.size(); i++) {
      position[order.get(i)] = i;
    }

    EliminationGraph working = new EliminationGraph(adjacency);
    List<BitSet> bags = new ArrayList<>(order.size());
    int[] parent = new int[order.size()];
    int root = order.size() - 1;
    for (int i = 0; i < order.size(); i++) {
      int v = order.get(i);
      BitSet bag = working.eliminate(v);
      bags.add(bag);
      int next = -1;
      for (int w = bag.nextSetBit(0); w >= 0; w = bag.nextSetBit(w + 1)) {
        if (w != v && (next < 0 || position[w] < next)) {
          next = position[w];
        }
      }
      parent[i] = next >= 0 ? next : (i == root ? -1 : root);
    }
    return new TreeDecomposition(List.copyOf(bags), parent);
  }

  /** One singleton bag per node, all attached to the last; valid for edgeless graphs only. */
  public static TreeDecomposition singletons(int nodeCount) {
    List<BitSet> bags = new ArrayList<>(nodeCount);
    int[] parent = new int[nodeCount];
    for (int v = 0; v < nodeCount; v++) {
      BitSet bag = new BitSet(nodeCount);
      bag.set(v);
      bags.add(bag);
      parent[v] = v == nodeCount - 1 ? -1 : nodeCount - 1;
    }
    return new TreeDecomposition(List.copyOf(bags), parent);
  }

  public int size() {
    return bags.size();
  }

  /** A copy of bag {@code i}. */
  public BitSet bag(int i) {
    return (BitSet) bags.get(i).clone();
  }

  /** Parent bag of {@code i}, or {@code -1} for the root. */
  public int parent(int i) {
    return parent[i];
  }

  /** Largest bag size minus one; 0 for an empty decomposition. */
  public int width() {
    int max = 0;
    for (BitSet bag : bags) {
      max = Math.max(max, bag.cardinality());
    }
    return Math.max(0, max - 1);
  }

  /**
   * Checks the decomposition against {@code adjacency}: every node is in a bag, every edge is
   * inside a bag, and the bags holding any node form a connected subtree.
   */
  public boolean isValidFor(BitSet[] adjacency) {
    int n = adjacency.length;
    if (n == 0) {
      return bags.isEmpty();
    }
    int[] occurrences = new int[n];
    for (BitSet bag : bags) {
      for (int v = bag.nextSetBit(0); v >= 0; v = bag.nextSetBit(v + 1)) {
        if (v >= n) {
          return false;
        }
        occurrences[v]++;
      }
    }
    for (int v = 0; v < n; v++) {
      if (occurrences[v] == 0) {
        return false;
      }
      for (int w = adjacency[v].nextSetBit(v + 1); w >= 0; w = adjacency[v].nextSetBit(w + 1)) {
        if (!coveredByBag(v, w)) {
          return false;
        }
      }
    }
    // In a tree, the bags containing v are connected iff they span exactly (count - 1) tree edges.
    int[] sharedEdges = new int[n];
    int roots = 0;
    for (int i = 0; i < bags.size(); i++) {
      if (parent[i] < 0) {
        roots++;
        continue;
      }
      BitSet shared = (BitSet) bags.get(i).clone();
      shared.and(bags.get(parent[i]));
      for (int v = shared.nextSetBit(0); v >= 0; v = shared.nextSetBit(v + 1)) {
        sharedEdges[v]++;
      }
    }
    if (roots != 1) {
      return false;
    }
    for (int v = 0; v < n; v++) {
      if (sharedEdges[v] != occurrences[v] - 1) {
        return false;
      }
    }
    return true;
  }

  private boolean coveredByBag(int v, int w) {
    for (BitSet bag : bags) {
      if (bag.get(v) && bag.get(w)) {
        return true;
      }
    }
    return false;
  }
}

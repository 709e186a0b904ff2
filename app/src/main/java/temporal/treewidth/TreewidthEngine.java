package temporal.treewidth;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.expansion.ExpansionGraph;
import temporal.util.GraphUtils;

/**
 * Computes the tree-width of an expansion graph.
 *
 * <p>Mode selection depends only on the node count:
 *
 * <ul>
 *   <li>at most one node, or no edges: width 0, {@link TreewidthMode#EXACT}, nothing eliminated;
 *   <li>up to {@link #exactNodeLimit()} nodes: exhaustive search, {@link TreewidthMode#EXACT};
 *   <li>otherwise: min-degree elimination, {@link TreewidthMode#HEURISTIC_UPPER_BOUND}.
 * </ul>
 *
 * The exact limit is clamped to {@link #HARD_EXACT_NODE_LIMIT}. Both paths break ties by lowest
 * node index, so repeated runs give identical widths and orderings.
 */
public final class TreewidthEngine {
  private static final Logger LOG = LoggerFactory.getLogger(TreewidthEngine.class);

  public static final int DEFAULT_EXACT_NODE_LIMIT = 12;
  public static final int HARD_EXACT_NODE_LIMIT = ExactTreewidthSolver.HARD_NODE_LIMIT;

  private final int exactNodeLimit;

  public TreewidthEngine() {
    this(DEFAULT_EXACT_NODE_LIMIT);
  }

  /** A limit of 0 disables the exact path for every non-trivial graph. */
  public TreewidthEngine(int exactNodeLimit) {
    if (exactNodeLimit < 0) {
      throw new IllegalArgumentException("exactNodeLimit must be non-negative");
    }
    this.exactNodeLimit = Math.min(exactNodeLimit, HARD_EXACT_NODE_LIMIT);
  }

  public int exactNodeLimit() {
    return exactNodeLimit;
  }

  /** The mode {@link #treewidth(BitSet[])} uses for a non-trivial graph of this size. */
  public TreewidthMode modeFor(int nodeCount) {
    return nodeCount <= exactNodeLimit ? TreewidthMode.EXACT : TreewidthMode.HEURISTIC_UPPER_BOUND;
  }

  public TreewidthReport treewidth(ExpansionGraph expansion) {
    Objects.requireNonNull(expansion, "expansion");
    return treewidth(expansion.undirectedAdjacency());
  }

  /** Tree-width of a simple undirected graph given as a symmetric adjacency array. */
  public TreewidthReport treewidth(BitSet[] adjacency) {
    Objects.requireNonNull(adjacency, "adjacency");
    int n = adjacency.length;
    if (n <= 1 || GraphUtils.edgeCount(adjacency) == 0) {
      List<Integer> identity = IntStream.range(0, n).boxed().toList();
      return new TreewidthReport(
          0, TreewidthMode.EXACT, identity, TreeDecomposition.singletons(n));
    }

    if (modeFor(n) == TreewidthMode.EXACT) {
      ExactTreewidthSolver.Solution solution = ExactTreewidthSolver.solve(adjacency);
      LOG.debug("Exact tree-width {} on {} nodes", solution.width(), n);
      TreeDecomposition decomposition =
          TreeDecomposition.fromOrdering(adjacency, solution.eliminationOrder());
      return new TreewidthReport(
          solution.width(), TreewidthMode.EXACT, solution.eliminationOrder(), decomposition);
    }

    List<Integer> order = minDegreeOrdering(adjacency);
    TreeDecomposition decomposition = TreeDecomposition.fromOrdering(adjacency, order);
    LOG.debug("Min-degree upper bound {} on {} nodes", decomposition.width(), n);
    return new TreewidthReport(
        decomposition.width(), TreewidthMode.HEURISTIC_UPPER_BOUND, order, decomposition);
  }

  /** Repeatedly eliminates the vertex of minimum current degree, lowest index first. */
  static List<Integer> minDegreeOrdering(BitSet[] adjacency) {
    EliminationGraph working = new EliminationGraph(adjacency);
    List<Integer> order = new ArrayList<>(adjacency.length);
    while (!working.isEmpty()) {
      int v = working.minDegreeVertex();
      working.eliminate(v);
      order.add(v);
    }
    return order;
  }
}

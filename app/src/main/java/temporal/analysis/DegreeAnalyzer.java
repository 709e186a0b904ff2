package temporal.analysis;

import java.util.Objects;
import temporal.expansion.ExpansionEdge;
import temporal.expansion.ExpansionGraph;

/** Degree statistics over an expansion graph, counting black and red edges alike. */
public final class DegreeAnalyzer {

  /** Degree of every node, in node-index order. */
  public int[] degrees(ExpansionGraph expansion) {
    Objects.requireNonNull(expansion, "expansion");
    int[] degree = new int[expansion.nodeCount()];
    for (ExpansionEdge edge : expansion.blackEdges()) {
      degree[edge.source()]++;
      degree[edge.target()]++;
    }
    for (ExpansionEdge edge : expansion.redEdges()) {
      degree[edge.source()]++;
      degree[edge.target()]++;
    }
    return degree;
  }

  /** Maximum node degree; 0 for an expansion without nodes. */
  public int maxDegree(ExpansionGraph expansion) {
    int max = 0;
    for (int d : degrees(expansion)) {
      max = Math.max(max, d);
    }
    return max;
  }
}

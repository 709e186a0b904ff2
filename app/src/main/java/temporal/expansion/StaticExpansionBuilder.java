package temporal.expansion;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.core.model.TemporalGraph;
import temporal.core.model.VertexPair;

/**
 * Unrolls a temporal graph (or a window of it) into its static expansion.
 *
 * <p>Enumeration order is fixed so repeated calls give identical output:
 *
 * <ul>
 *   <li>nodes by ascending time, then ascending vertex id;
 *   <li>black edges by ascending time, then snapshot insertion order;
 *   <li>red edges by ascending time, then ascending vertex id.
 * </ul>
 *
 * Red edges are derived from the vertex and time ranges; the temporal graph never stores them.
 */
public final class StaticExpansionBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(StaticExpansionBuilder.class);

  /** Full static expansion over the whole lifetime. */
  public ExpansionGraph expand(TemporalGraph graph) {
    Objects.requireNonNull(graph, "graph");
    return expand(graph, TimeWindow.full(graph));
  }

  /** The differential of {@code graph} starting at {@code start} with width {@code delta}. */
  public ExpansionGraph expand(TemporalGraph graph, int start, int delta) {
    return expand(graph, TimeWindow.of(start, delta));
  }

  public ExpansionGraph expand(TemporalGraph graph, TimeWindow window) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(window, "window");
    window.validateAgainst(graph.lifetime());

    int[] vertexIds = graph.sortedVertices();
    int n = vertexIds.length;

    List<ExpansionNode> nodes = new ArrayList<>(n * window.width());
    for (int offset = 0; offset < window.width(); offset++) {
      int time = window.start() + offset;
      for (int rank = 0; rank < n; rank++) {
        nodes.add(new ExpansionNode(offset * n + rank, vertexIds[rank], time));
      }
    }

    List<ExpansionEdge> black = new ArrayList<>();
    for (int offset = 0; offset < window.width(); offset++) {
      int time = window.start() + offset;
      for (VertexPair pair : graph.snapshot(time)) {
        int source = offset * n + graph.indexOf(pair.first());
        int target = offset * n + graph.indexOf(pair.second());
        black.add(new ExpansionEdge(black.size(), source, target, EdgeType.BLACK));
      }
    }

    List<ExpansionEdge> red = new ArrayList<>(n * (window.width() - 1));
    for (int offset = 0; offset + 1 < window.width(); offset++) {
      for (int rank = 0; rank < n; rank++) {
        int source = offset * n + rank;
        red.add(new ExpansionEdge(red.size(), source, source + n, EdgeType.RED));
      }
    }

    ExpansionGraph expansion = new ExpansionGraph(vertexIds, window, nodes, black, red);
    LOG.debug("Expanded {} over {} -> {}", graph, window, expansion.summary());
    return expansion;
  }
}

package temporal.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import temporal.expansion.ExpansionEdge;
import temporal.expansion.ExpansionGraph;
import temporal.expansion.ExpansionNode;
import temporal.expansion.ExpansionSummary;

/**
 * Serializes an expansion graph as node records {@code (id, label, vertex, time)}, edge records
 * {@code (id, source, target, type)} and a trailing {@code stats} summary.
 */
public final class ExpansionGraphJson {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private ExpansionGraphJson() {}

  public static String write(ExpansionGraph expansion) {
    return GSON.toJson(toTree(expansion));
  }

  static Map<String, Object> toTree(ExpansionGraph expansion) {
    Objects.requireNonNull(expansion, "expansion");
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("nodes", nodes(expansion));
    root.put("edges", edges(expansion));
    root.put("stats", stats(expansion.summary()));
    return root;
  }

  private static List<Map<String, Object>> nodes(ExpansionGraph expansion) {
    List<Map<String, Object>> list = new ArrayList<>(expansion.nodeCount());
    for (ExpansionNode node : expansion.nodes()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", node.id());
      map.put("label", node.label());
      map.put("vertex", node.vertex());
      map.put("time", node.time());
      list.add(map);
    }
    return list;
  }

  private static List<Map<String, Object>> edges(ExpansionGraph expansion) {
    List<Map<String, Object>> list = new ArrayList<>(expansion.edgeCount());
    for (ExpansionEdge edge : expansion.edges()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", edge.id());
      map.put("source", expansion.node(edge.source()).id());
      map.put("target", expansion.node(edge.target()).id());
      map.put("type", edge.type().wireName());
      list.add(map);
    }
    return list;
  }

  private static Map<String, Object> stats(ExpansionSummary summary) {
    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("num_nodes", summary.numNodes());
    stats.put("num_black_edges", summary.numBlackEdges());
    stats.put("num_red_edges", summary.numRedEdges());
    return stats;
  }
}

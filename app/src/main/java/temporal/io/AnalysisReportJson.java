package temporal.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import temporal.core.AnalysisReport;
import temporal.core.model.TwinPair;
import temporal.treewidth.DifferentialTreewidthReport;
import temporal.treewidth.WindowTreewidth;

/** Renders an {@link AnalysisReport} with the snake_case keys the front end reads. */
public final class AnalysisReportJson {
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  public String build(AnalysisReport report) {
    return gson.toJson(toTree(report));
  }

  Map<String, Object> toTree(AnalysisReport report) {
    Objects.requireNonNull(report, "report");
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("t", report.window().start());
    root.put("delta", report.window().width());
    root.put("eternal_twins", twins(report));
    root.put("num_eternal_twins", report.eternalTwins().size());
    root.put("max_degree_differential", report.maxDegree());
    root.put("tw_current_differential", report.currentTreewidth());
    root.put("treewidth_mode", report.current().mode().name().toLowerCase(Locale.ROOT));
    root.put("dtw_delta", report.dtwDelta());
    root.put("dtw_per_t", perStart(report.differential()));
    root.put("dtw_exact", report.differential().allExact());
    root.put("lifetime", report.lifetime());
    root.put("num_vertices", report.vertexCount());
    root.put("edge_counts_per_snapshot", report.snapshotEdgeCounts());
    root.put("union_graph_edge_count", report.unionEdgeCount());
    return root;
  }

  private List<Map<String, Object>> twins(AnalysisReport report) {
    List<Map<String, Object>> list = new ArrayList<>(report.eternalTwins().size());
    for (TwinPair pair : report.eternalTwins()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("u", pair.u());
      map.put("v", pair.v());
      list.add(map);
    }
    return list;
  }

  private List<List<Integer>> perStart(DifferentialTreewidthReport differential) {
    List<List<Integer>> list = new ArrayList<>(differential.perStart().size());
    for (WindowTreewidth window : differential.perStart()) {
      list.add(List.of(window.start(), window.width()));
    }
    return list;
  }
}

package temporal.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import org.junit.jupiter.api.Test;
import temporal.core.TemporalGraphEngine;
import temporal.testing.Graphs;

final class AnalysisReportJsonTest {

  @Test
  void writesAllReportKeys() {
    JsonObject root =
        JsonParser.parseString(
                new AnalysisReportJson()
                    .build(new TemporalGraphEngine().treewidth(Graphs.pathAndMatching(), 0, 1)))
            .getAsJsonObject();

    assertEquals(
        List.of(
            "t",
            "delta",
            "eternal_twins",
            "num_eternal_twins",
            "max_degree_differential",
            "tw_current_differential",
            "treewidth_mode",
            "dtw_delta",
            "dtw_per_t",
            "dtw_exact",
            "lifetime",
            "num_vertices",
            "edge_counts_per_snapshot",
            "union_graph_edge_count"),
        List.copyOf(root.keySet()));
    assertEquals("exact", root.get("treewidth_mode").getAsString());
    assertEquals(1, root.get("tw_current_differential").getAsInt());
    assertEquals(2, root.get("max_degree_differential").getAsInt());
    assertTrue(root.get("dtw_exact").getAsBoolean());

    JsonArray perStart = root.getAsJsonArray("dtw_per_t");
    assertEquals(2, perStart.size());
    assertEquals(1, perStart.get(1).getAsJsonArray().get(0).getAsInt());
    assertEquals(1, perStart.get(1).getAsJsonArray().get(1).getAsInt());
    assertEquals(3, root.get("union_graph_edge_count").getAsInt());
  }

  @Test
  void listsTwinPairsAsObjects() {
    JsonObject root =
        JsonParser.parseString(
                new AnalysisReportJson()
                    .build(
                        new TemporalGraphEngine()
                            .treewidth(
                                Graphs.repeated(3, 2, new int[][] {{0, 2}, {1, 2}}), 0, 2)))
            .getAsJsonObject();

    JsonArray twins = root.getAsJsonArray("eternal_twins");
    assertEquals(1, twins.size());
    assertEquals(0, twins.get(0).getAsJsonObject().get("u").getAsInt());
    assertEquals(1, twins.get(0).getAsJsonObject().get("v").getAsInt());
    assertEquals(1, root.get("num_eternal_twins").getAsInt());
  }
}

package temporal.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import temporal.core.InvalidGraphException;
import temporal.core.model.TemporalGraph;
import temporal.core.model.VertexPair;
import temporal.testing.Graphs;

final class TemporalGraphJsonTest {

  @Test
  void parsesRecordWithLifetime() {
    TemporalGraph graph =
        TemporalGraphJson.parse(
            "{\"vertices\": [0, 1, 2], \"snapshots\": [[[0, 1]], [[1, 2], [0, 2]]],"
                + " \"lifetime\": 2}");

    assertEquals(List.of(0, 1, 2), graph.vertices());
    assertEquals(2, graph.lifetime());
    assertEquals(List.of(VertexPair.of(1, 2), VertexPair.of(0, 2)), graph.snapshot(1));
  }

  @Test
  void lifetimeIsOptionalAndGraphWrapperIsAccepted() {
    TemporalGraph graph =
        TemporalGraphJson.parse("{\"graph\": {\"vertices\": [4, 7], \"snapshots\": [[[4, 7]]]}}");

    assertEquals(1, graph.lifetime());
    assertEquals(List.of(4, 7), graph.vertices());
  }

  @Test
  void writtenRecordCarriesDerivedLifetime() {
    JsonObject tree =
        JsonParser.parseString(TemporalGraphJson.write(Graphs.pathAndMatching()))
            .getAsJsonObject();

    assertEquals(List.of("vertices", "snapshots", "lifetime"), List.copyOf(tree.keySet()));
    assertEquals(2, tree.get("lifetime").getAsInt());
    assertEquals(2, tree.getAsJsonArray("snapshots").get(1).getAsJsonArray().size());
  }

  @Test
  void fileRoundTripKeepsTheGraph(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("graph.json");
    TemporalGraph graph = Graphs.pathAndMatching();

    TemporalGraphJson.write(graph, file);
    assertEquals(graph, TemporalGraphJson.read(file));
  }

  @Test
  void rejectsLifetimeMismatch() {
    InvalidGraphException ex =
        assertThrows(
            InvalidGraphException.class,
            () ->
                TemporalGraphJson.parse(
                    "{\"vertices\": [0, 1], \"snapshots\": [[]], \"lifetime\": 3}"));
    assertEquals("lifetime", ex.field());
  }

  @Test
  void rejectsGraphWithoutSnapshots() {
    assertEquals("snapshots", fieldOf("{\"vertices\": [0, 1, 2], \"snapshots\": []}"));
    assertEquals(
        "snapshots", fieldOf("{\"vertices\": [0, 1], \"snapshots\": [], \"lifetime\": 0}"));
  }

  @Test
  void rejectsStructuralProblems() {
    assertEquals("graph", fieldOf("{not json"));
    assertEquals("graph", fieldOf("[1, 2]"));
    assertEquals("vertices", fieldOf("{\"snapshots\": []}"));
    assertEquals("snapshots", fieldOf("{\"vertices\": [0]}"));
    assertEquals("vertices[1]", fieldOf("{\"vertices\": [0, 1.5], \"snapshots\": []}"));
    assertEquals("vertices[0]", fieldOf("{\"vertices\": [\"a\"], \"snapshots\": []}"));
    assertEquals("snapshots[0]", fieldOf("{\"vertices\": [0], \"snapshots\": [5]}"));
    assertEquals(
        "snapshots[0][0]", fieldOf("{\"vertices\": [0, 1], \"snapshots\": [[[0, 1, 2]]]}"));
  }

  @Test
  void rejectsEdgesOnUnknownVertices() {
    assertEquals("snapshots[0]", fieldOf("{\"vertices\": [0, 1], \"snapshots\": [[[0, 9]]]}"));
    assertEquals("snapshots[0]", fieldOf("{\"vertices\": [0, 1], \"snapshots\": [[[1, 1]]]}"));
  }

  private static String fieldOf(String json) {
    return assertThrows(InvalidGraphException.class, () -> TemporalGraphJson.parse(json)).field();
  }
}

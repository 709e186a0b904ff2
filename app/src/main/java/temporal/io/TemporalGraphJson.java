package temporal.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import temporal.core.InvalidGraphException;
import temporal.core.model.TemporalGraph;
import temporal.core.model.VertexPair;

/**
 * Reads and writes the temporal-graph interchange record:
 *
 * <pre>{@code
 * {"vertices": [0, 1, 2], "snapshots": [[[0, 1]], [[1, 2], [0, 2]]], "lifetime": 2}
 * }</pre>
 *
 * {@code lifetime} is derived on export; on import it is optional but must match the number of
 * snapshots when present. Every structural problem surfaces as an {@link InvalidGraphException}.
 */
public final class TemporalGraphJson {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private TemporalGraphJson() {}

  public static String write(TemporalGraph graph) {
    return GSON.toJson(toTree(graph));
  }

  public static void write(TemporalGraph graph, Path file) throws IOException {
    Files.writeString(file, write(graph), StandardCharsets.UTF_8);
  }

  static Map<String, Object> toTree(TemporalGraph graph) {
    Objects.requireNonNull(graph, "graph");
    List<List<List<Integer>>> snapshots = new ArrayList<>(graph.lifetime());
    for (List<VertexPair> snapshot : graph.snapshots()) {
      snapshots.add(snapshot.stream().map(p -> List.of(p.first(), p.second())).toList());
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("vertices", graph.vertices());
    root.put("snapshots", snapshots);
    root.put("lifetime", graph.lifetime());
    return root;
  }

  public static TemporalGraph read(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    return parse(Files.readString(file, StandardCharsets.UTF_8));
  }

  public static TemporalGraph parse(String json) {
    Objects.requireNonNull(json, "json");
    JsonElement parsed;
    try {
      parsed = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new InvalidGraphException("graph", null, "Malformed JSON: " + ex.getMessage());
    }
    return fromTree(parsed);
  }

  /**
   * Builds a graph from a parsed record. Accepts either the record itself or an object wrapping it
   * under a {@code graph} key.
   */
  public static TemporalGraph fromTree(JsonElement element) {
    if (element == null || !element.isJsonObject()) {
      throw new InvalidGraphException("graph", element, "Expected a JSON object");
    }
    JsonObject root = element.getAsJsonObject();
    if (!root.has("vertices") && root.has("graph")) {
      return fromTree(root.get("graph"));
    }

    JsonArray vertexArray = requireArray(root, "vertices");
    List<Integer> vertices = new ArrayList<>(vertexArray.size());
    for (int i = 0; i < vertexArray.size(); i++) {
      vertices.add(readInt(vertexArray.get(i), "vertices[" + i + "]"));
    }

    JsonArray snapshotArray = requireArray(root, "snapshots");
    if (root.has("lifetime") && !root.get("lifetime").isJsonNull()) {
      int lifetime = readInt(root.get("lifetime"), "lifetime");
      if (lifetime != snapshotArray.size()) {
        throw new InvalidGraphException(
            "lifetime",
            lifetime,
            "lifetime " + lifetime + " does not match " + snapshotArray.size() + " snapshots");
      }
    }

    List<List<VertexPair>> snapshots = new ArrayList<>(snapshotArray.size());
    for (int t = 0; t < snapshotArray.size(); t++) {
      String field = "snapshots[" + t + "]";
      JsonElement snapshot = snapshotArray.get(t);
      if (!snapshot.isJsonArray()) {
        throw new InvalidGraphException(field, snapshot, field + " must be a list of pairs");
      }
      List<VertexPair> edges = new ArrayList<>();
      JsonArray pairs = snapshot.getAsJsonArray();
      for (int e = 0; e < pairs.size(); e++) {
        String edgeField = field + "[" + e + "]";
        JsonElement pair = pairs.get(e);
        if (!pair.isJsonArray() || pair.getAsJsonArray().size() != 2) {
          throw new InvalidGraphException(
              edgeField, pair, edgeField + " must be a 2-element vertex pair");
        }
        JsonArray endpoints = pair.getAsJsonArray();
        edges.add(
            VertexPair.of(
                readInt(endpoints.get(0), edgeField), readInt(endpoints.get(1), edgeField)));
      }
      snapshots.add(edges);
    }
    return TemporalGraph.of(vertices, snapshots);
  }

  private static JsonArray requireArray(JsonObject root, String field) {
    JsonElement value = root.get(field);
    if (value == null || !value.isJsonArray()) {
      throw new InvalidGraphException(field, value, "Missing or non-list field '" + field + "'");
    }
    return value.getAsJsonArray();
  }

  private static int readInt(JsonElement element, String field) {
    if (element == null
        || !element.isJsonPrimitive()
        || !element.getAsJsonPrimitive().isNumber()) {
      throw new InvalidGraphException(field, element, field + " must be an integer");
    }
    try {
      BigDecimal value = element.getAsBigDecimal();
      return value.intValueExact();
    } catch (ArithmeticException | NumberFormatException ex) {
      throw new InvalidGraphException(field, element, field + " must be an integer");
    }
  }
}

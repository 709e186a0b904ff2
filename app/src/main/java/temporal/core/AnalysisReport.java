package temporal.core;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import temporal.core.model.TwinPair;
import temporal.expansion.TimeWindow;
import temporal.treewidth.DifferentialTreewidthReport;
import temporal.treewidth.TreewidthReport;

/**
 * Result of analysing one window of a temporal graph: tree-width of the window, the
 * Δ-differential tree-width over all starts, maximum degree, and whole-graph statistics.
 */
public record AnalysisReport(
    TimeWindow window,
    TreewidthReport current,
    DifferentialTreewidthReport differential,
    int maxDegree,
    Set<TwinPair> eternalTwins,
    int lifetime,
    int vertexCount,
    List<Integer> snapshotEdgeCounts,
    int unionEdgeCount) {

  public AnalysisReport {
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(differential, "differential");
    eternalTwins = Collections.unmodifiableSortedSet(new TreeSet<>(eternalTwins));
    snapshotEdgeCounts = List.copyOf(snapshotEdgeCounts);
  }

  public int currentTreewidth() {
    return current.width();
  }

  public int dtwDelta() {
    return differential.minimum();
  }
}

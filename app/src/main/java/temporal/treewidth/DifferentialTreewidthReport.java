package temporal.treewidth;

import java.util.List;

/**
 * Tree-width of every width-{@code delta} window, in ascending start order, and their minimum
 * (the Δ-differential tree-width).
 */
public record DifferentialTreewidthReport(int delta, List<WindowTreewidth> perStart) {

  public DifferentialTreewidthReport {
    perStart = List.copyOf(perStart);
    if (perStart.isEmpty()) {
      throw new IllegalArgumentException("At least one window is required");
    }
  }

  /** dtw_Δ: the smallest window tree-width. */
  public int minimum() {
    return perStart.stream().mapToInt(WindowTreewidth::width).min().orElseThrow();
  }

  /** Start time of the first window achieving {@link #minimum()}. */
  public int argMinimum() {
    int min = minimum();
    return perStart.stream().filter(w -> w.width() == min).findFirst().orElseThrow().start();
  }

  /** True when every window width is exact, making {@link #minimum()} exact too. */
  public boolean allExact() {
    return perStart.stream().allMatch(w -> w.report().isExact());
  }
}

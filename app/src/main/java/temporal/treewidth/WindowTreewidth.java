package temporal.treewidth;

import java.util.Objects;

/** Tree-width of the differential starting at {@code start}. */
public record WindowTreewidth(int start, TreewidthReport report) {

  public WindowTreewidth {
    Objects.requireNonNull(report, "report");
  }

  public int width() {
    return report.width();
  }
}

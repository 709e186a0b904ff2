package temporal.expansion;

import temporal.core.InvalidWindowException;
import temporal.core.model.TemporalGraph;

/** Contiguous run of {@code width} snapshots beginning at {@code start}. */
public record TimeWindow(int start, int width) {

  public static TimeWindow of(int start, int width) {
    return new TimeWindow(start, width);
  }

  /** The window spanning the whole lifetime of {@code graph}. */
  public static TimeWindow full(TemporalGraph graph) {
    return new TimeWindow(0, graph.lifetime());
  }

  /** Last snapshot index covered by the window. */
  public int end() {
    return start + width - 1;
  }

  public boolean contains(int time) {
    return time >= start && time <= end();
  }

  /**
   * Checks {@code 0 <= start}, {@code width >= 1} and {@code start + width <= lifetime}.
   *
   * @throws InvalidWindowException naming the first violated bound
   */
  public TimeWindow validateAgainst(int lifetime) {
    if (start < 0) {
      throw new InvalidWindowException(
          "t", start, "Window start must be non-negative, got t=" + start);
    }
    if (width < 1) {
      throw new InvalidWindowException("delta", width, "Window width must be >= 1, got " + width);
    }
    if ((long) start + width > lifetime) {
      throw new InvalidWindowException(
          "delta",
          width,
          "Window t="
              + start
              + ", delta="
              + width
              + " exceeds lifetime "
              + lifetime
              + " (need t + delta <= lifetime)");
    }
    return this;
  }
}

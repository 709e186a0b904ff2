package temporal.treewidth;

import java.util.List;
import java.util.Objects;

/**
 * Tree-width of one graph together with the elimination ordering and tree decomposition that
 * witness it.
 */
public record TreewidthReport(
    int width,
    TreewidthMode mode,
    List<Integer> eliminationOrder,
    TreeDecomposition decomposition) {

  public TreewidthReport {
    Objects.requireNonNull(mode, "mode");
    eliminationOrder = List.copyOf(eliminationOrder);
    Objects.requireNonNull(decomposition, "decomposition");
    if (width < 0) {
      throw new IllegalArgumentException("width must be non-negative");
    }
  }

  public boolean isExact() {
    return mode.isExact();
  }
}

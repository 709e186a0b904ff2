package temporal.treewidth;

/** How a tree-width figure was obtained. */
public enum TreewidthMode {
  /** Exhaustive search, or a graph trivial enough that the answer is known. */
  EXACT,
  /** Min-degree elimination; the width is an upper bound. */
  HEURISTIC_UPPER_BOUND;

  public boolean isExact() {
    return this == EXACT;
  }
}

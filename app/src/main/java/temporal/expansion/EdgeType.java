package temporal.expansion;

import java.util.Locale;

/** The two edge classes of a static expansion. */
public enum EdgeType {
  /** Same-time adjacency copied from a snapshot. */
  BLACK,
  /** Identity of one vertex between consecutive times. */
  RED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

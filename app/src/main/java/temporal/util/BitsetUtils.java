package temporal.util;

import java.util.BitSet;

/** Helpers for {@link BitSet} vertex sets and adjacency arrays. */
public final class BitsetUtils {
  private BitsetUtils() {}

  /** {@code set} without {@code excluded}, leaving the argument untouched. */
  public static BitSet without(BitSet set, int excluded) {
    BitSet clone = (BitSet) set.clone();
    clone.clear(excluded);
    return clone;
  }

  public static BitSet[] deepCopy(BitSet[] sets) {
    BitSet[] copy = new BitSet[sets.length];
    for (int i = 0; i < sets.length; i++) {
      copy[i] = (BitSet) sets[i].clone();
    }
    return copy;
  }
}

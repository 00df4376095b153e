package edu.washington.escience.arrayagg.operator.agg;

/**
 * The order a comparator aggregate keeps the extreme of.
 */
public enum ComparatorOp {
  /** Keep the smallest value. */
  MIN,
  /** Keep the largest value. */
  MAX;

  /**
   * @param comparison the result of comparing a candidate with the current value.
   * @return true if the candidate replaces the current value.
   */
  public boolean prefers(final int comparison) {
    return this == MIN ? comparison < 0 : comparison > 0;
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import com.google.common.math.LongMath;

import edu.washington.escience.arrayagg.storage.AggregateBuffer;

/**
 * The cell scan shared by the aggregators. A cell of the window is selected if its bitmap weight is not 0 and, for
 * nullable fields with validity data, its validity byte is not 0.
 */
public final class AggregateKernel {

  /** Receives the selected cells of a scan. */
  @FunctionalInterface
  public interface CellVisitor {
    /**
     * @param cell a selected cell.
     * @param weight how many times the cell counts, at least 1.
     * @throws ArithmeticException if folding the cell overflows.
     */
    void visit(int cell, long weight);
  }

  /** Utility class. */
  private AggregateKernel() {}

  /**
   * Visit every selected cell of the window once.
   *
   * @param input the cells.
   * @param nullable whether validity data must be honored.
   * @param visitor receives each selected cell with its weight.
   * @return the number of selected cells, weight adjusted.
   * @throws ArithmeticException if the visitor overflows or the count does not fit a long.
   */
  public static long aggregateWithCount(final AggregateBuffer input, final boolean nullable,
      final CellVisitor visitor) {
    final boolean checkValidity = nullable && input.validityData() != null;
    long count = 0;
    for (int cell = input.minCell(); cell < input.maxCell(); ++cell) {
      long weight = input.weight(cell);
      if (weight == 0) {
        continue;
      }
      if (checkValidity && !input.isValid(cell)) {
        continue;
      }
      visitor.visit(cell, weight);
      count = LongMath.checkedAdd(count, weight);
    }
    return count;
  }

  /**
   * Count the cells of the window, weight adjusted.
   *
   * @param input the cells.
   * @param policy which cells to count.
   * @return the count.
   */
  public static long countCells(final AggregateBuffer input, final ValidityPolicy policy) {
    if (policy == ValidityPolicy.NULL && input.validityData() == null) {
      return 0;
    }
    long count = 0;
    for (int cell = input.minCell(); cell < input.maxCell(); ++cell) {
      if (policy == ValidityPolicy.NULL && input.isValid(cell)) {
        continue;
      }
      count += input.weight(cell);
    }
    return count;
  }
}

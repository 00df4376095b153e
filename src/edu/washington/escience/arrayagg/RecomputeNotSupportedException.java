package edu.washington.escience.arrayagg;

/**
 * A result did not fit in its destination after another aggregate of the same channel was already written for the
 * current read step. The step cannot be replayed, so the query step fails.
 */
public class RecomputeNotSupportedException extends DbException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /** The message carried by every instance. */
  public static final String MESSAGE = "overflow after aggregate already computed; recompute not supported";

  /**
   * @param outputName the output field whose result did not fit.
   * @param cause the capacity error.
   */
  public RecomputeNotSupportedException(final String outputName, final AggregateCapacityException cause) {
    super(MESSAGE + " (output field " + outputName + ")", cause);
  }
}

package edu.washington.escience.arrayagg;

/** A variable-length result does not fit in the var buffer the user bound for it. */
public class AggregateCapacityException extends DbException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /** Number of bytes the result needs. */
  private final long required;

  /**
   * @param origin the component reporting the error.
   * @param fieldName the aggregated field.
   * @param required number of bytes the result needs.
   */
  public AggregateCapacityException(final String origin, final String fieldName, final long required) {
    super(origin + ": Min/max buffer not big enough for " + fieldName + ". Required: " + required);
    this.required = required;
  }

  /** @return number of bytes the result needs. */
  public long getRequired() {
    return required;
  }
}

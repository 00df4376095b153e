package edu.washington.escience.arrayagg.operator.agg;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.Datatype;

/**
 * The aggregates that can be requested for an output field.
 */
public enum AggregationOp {
  /** COUNT. Takes no input field. Result is always {@link Datatype#UINT64}. */
  COUNT,
  /** NULL_COUNT. Applies to nullable fields of any type. Result is always {@link Datatype#UINT64}. */
  NULL_COUNT,
  /** SUM. Applies to numeric types. Result is the 64 bit type of the same kind. */
  SUM,
  /** MEAN. Applies to numeric types. Result is always {@link Datatype#FLOAT64}. */
  MEAN,
  /** MIN. Applies to numeric and string types. Result is same as input type. */
  MIN,
  /** MAX. Applies to numeric and string types. Result is same as input type. */
  MAX;

  /** @return the name this aggregate is requested by. */
  public String getName() {
    return name();
  }

  /**
   * @param name a requested aggregate name.
   * @return the aggregate.
   * @throws AggregateConfigurationException if no aggregate has that name.
   */
  public static AggregationOp fromName(final String name) throws AggregateConfigurationException {
    for (AggregationOp op : values()) {
      if (op.getName().equals(name)) {
        return op;
      }
    }
    throw new AggregateConfigurationException("Operation", "Unsupported aggregation " + name);
  }
}

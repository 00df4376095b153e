package edu.washington.escience.arrayagg.operator.agg;

import javax.annotation.Nullable;

import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.FieldInfo;

/**
 * COUNT: the number of selected cells, weighted by the count bitmap if any.
 */
public final class CountAggregator extends CountAggregatorBase {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** COUNT has no input field. */
  public CountAggregator() {
    super(ValidityPolicy.NON_NULL);
  }

  @Override
  public AggregationOp aggregationOp() {
    return AggregationOp.COUNT;
  }

  @Override
  @Nullable
  public FieldInfo fieldInfo() {
    return null;
  }

  @Override
  public String fieldName() {
    return ArrayAggConstants.COUNT_OF_ROWS;
  }
}

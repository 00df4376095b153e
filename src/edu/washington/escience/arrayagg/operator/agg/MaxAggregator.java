package edu.washington.escience.arrayagg.operator.agg;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.FieldInfo;

/**
 * MAX: the largest selected non-null value. Numbers compare numerically, strings byte-wise.
 *
 * @param <T> the Java type holding one value.
 */
public final class MaxAggregator<T> extends ComparatorAggregator<T> {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param field the aggregated field.
   * @param valueType reads, orders and writes the values of the field.
   * @throws AggregateConfigurationException if the field cannot be aggregated.
   */
  public MaxAggregator(final FieldInfo field, final ValueType<T> valueType) throws AggregateConfigurationException {
    super(field, valueType, ComparatorOp.MAX);
  }

  /**
   * @param field the aggregated field.
   * @return the aggregator, with the value type of the field's datatype.
   * @throws AggregateConfigurationException if the field cannot be aggregated.
   */
  public static MaxAggregator<?> of(final FieldInfo field) throws AggregateConfigurationException {
    InputFieldValidator.ensureFieldIsComparable(field);
    return create(field, ValueTypes.forDatatype(field.getDatatype()));
  }

  /**
   * @param field the aggregated field.
   * @param valueType the value type of the field's datatype.
   * @param <T> the Java type holding one value.
   * @return the aggregator.
   * @throws AggregateConfigurationException if the field cannot be aggregated.
   */
  private static <T> MaxAggregator<T> create(final FieldInfo field, final ValueType<T> valueType)
      throws AggregateConfigurationException {
    return new MaxAggregator<>(field, valueType);
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.FieldInfo;

/**
 * MIN: the smallest selected non-null value. Numbers compare numerically, strings byte-wise.
 *
 * @param <T> the Java type holding one value.
 */
public final class MinAggregator<T> extends ComparatorAggregator<T> {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param field the aggregated field.
   * @param valueType reads, orders and writes the values of the field.
   * @throws AggregateConfigurationException if the field cannot be aggregated.
   */
  public MinAggregator(final FieldInfo field, final ValueType<T> valueType) throws AggregateConfigurationException {
    super(field, valueType, ComparatorOp.MIN);
  }

  /**
   * @param field the aggregated field.
   * @return the aggregator, with the value type of the field's datatype.
   * @throws AggregateConfigurationException if the field cannot be aggregated.
   */
  public static MinAggregator<?> of(final FieldInfo field) throws AggregateConfigurationException {
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
  private static <T> MinAggregator<T> create(final FieldInfo field, final ValueType<T> valueType)
      throws AggregateConfigurationException {
    return new MinAggregator<>(field, valueType);
  }
}

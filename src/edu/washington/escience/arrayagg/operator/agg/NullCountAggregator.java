package edu.washington.escience.arrayagg.operator.agg;

import java.util.Objects;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.FieldInfo;

/**
 * NULL_COUNT: the number of selected null cells of a nullable field.
 */
public final class NullCountAggregator extends CountAggregatorBase {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The counted field. */
  private final FieldInfo field;

  /**
   * @param field the counted field.
   * @throws AggregateConfigurationException if the field is not nullable.
   */
  public NullCountAggregator(final FieldInfo field) throws AggregateConfigurationException {
    super(ValidityPolicy.NULL);
    this.field = Objects.requireNonNull(field, "field");
    InputFieldValidator.ensureFieldIsNullable(field);
  }

  @Override
  public AggregationOp aggregationOp() {
    return AggregationOp.NULL_COUNT;
  }

  @Override
  public FieldInfo fieldInfo() {
    return field;
  }

  @Override
  public String fieldName() {
    return field.getName();
  }
}

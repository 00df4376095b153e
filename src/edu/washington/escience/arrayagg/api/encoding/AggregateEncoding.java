package edu.washington.escience.arrayagg.api.encoding;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.operator.agg.AggregationOp;
import edu.washington.escience.arrayagg.operator.agg.Aggregator;
import edu.washington.escience.arrayagg.operator.agg.AggregatorFactory;

/** JSON wrapper for one requested aggregate. */
public class AggregateEncoding extends ArrayAggEncoding {
  /** The aggregate, e.g. "SUM". */
  @Required public String aggregateName;
  /** The output field the aggregate is bound to. */
  @Required public String outputFieldName;
  /** The aggregated field, absent for COUNT. */
  public FieldInfo inputField;

  /**
   * @param aggregator an aggregator.
   * @param outputFieldName the output field it is bound to.
   * @return its encoding.
   */
  public static AggregateEncoding of(final Aggregator aggregator, final String outputFieldName) {
    AggregateEncoding encoding = new AggregateEncoding();
    encoding.aggregateName = aggregator.aggregationOp().getName();
    encoding.outputFieldName = outputFieldName;
    encoding.inputField = aggregator.fieldInfo();
    return encoding;
  }

  @Override
  protected void validateExtra() throws AggregateConfigurationException {
    AggregationOp op = AggregationOp.fromName(aggregateName);
    if (op != AggregationOp.COUNT && inputField == null) {
      throw new AggregateConfigurationException(getClass().getSimpleName(),
          aggregateName + " aggregate " + outputFieldName + " requires an input field.");
    }
  }

  /**
   * @return a new aggregator computing this aggregate.
   * @throws AggregateConfigurationException if the encoding is invalid or the aggregate does not apply to the field.
   */
  public Aggregator construct() throws AggregateConfigurationException {
    validate();
    return AggregatorFactory.makeOperation(aggregateName, inputField);
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.FieldInfo;

/**
 * Creates instances of the {@link Aggregator} class from a requested aggregate and the field it reads. The aggregator
 * constructors validate the field themselves, so a field rejected here is rejected by direct construction too.
 */
public final class AggregatorFactory {

  /** Reported by request errors. */
  static final String ORIGIN = "Operation";

  /** Utility class. */
  private AggregatorFactory() {}

  /**
   * @param name the requested aggregate, e.g. "SUM".
   * @param field the aggregated field, null for COUNT.
   * @return a new aggregator.
   * @throws AggregateConfigurationException if the aggregate is unknown or does not apply to the field.
   */
  @Nonnull
  public static Aggregator makeOperation(final String name, @Nullable final FieldInfo field)
      throws AggregateConfigurationException {
    return makeOperation(AggregationOp.fromName(Objects.requireNonNull(name, "name")), field);
  }

  /**
   * @param op the requested aggregate.
   * @param field the aggregated field, null for COUNT.
   * @return a new aggregator.
   * @throws AggregateConfigurationException if the aggregate does not apply to the field.
   */
  @Nonnull
  public static Aggregator makeOperation(final AggregationOp op, @Nullable final FieldInfo field)
      throws AggregateConfigurationException {
    Objects.requireNonNull(op, "op");
    if (op == AggregationOp.COUNT) {
      return new CountAggregator();
    }
    if (field == null) {
      throw new AggregateConfigurationException(ORIGIN, op.getName() + " aggregates require an input field.");
    }
    switch (op) {
      case NULL_COUNT:
        return new NullCountAggregator(field);
      case SUM:
        return new SumAggregator(field);
      case MEAN:
        return new MeanAggregator(field);
      case MIN:
        return MinAggregator.of(field);
      case MAX:
        return MaxAggregator.of(field);
      default:
        throw new AggregateConfigurationException(ORIGIN, "Unsupported aggregation " + op);
    }
  }
}

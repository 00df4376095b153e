package edu.washington.escience.arrayagg.operator.agg;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.Datatype;

/**
 * Picks the {@link ValueType} of a datatype.
 */
public final class ValueTypes {

  /** Utility class. */
  private ValueTypes() {}

  /**
   * @param datatype a datatype.
   * @return the value type handling it.
   * @throws AggregateConfigurationException if MIN and MAX do not apply to the datatype.
   */
  public static ValueType<?> forDatatype(final Datatype datatype) throws AggregateConfigurationException {
    switch (datatype.getValueKind()) {
      case SIGNED_INTEGER:
        return SignedIntegerValueType.INSTANCE;
      case UNSIGNED_INTEGER:
        return UnsignedIntegerValueType.INSTANCE;
      case FLOATING_POINT:
        return FloatingValueType.INSTANCE;
      case STRING:
        return StringValueType.INSTANCE;
      default:
        throw new AggregateConfigurationException(InputFieldValidator.ORIGIN,
            "Aggregate is not supported for datatype " + datatype + ".");
    }
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.FieldInfo;

/**
 * Checks run by aggregator constructors on the field they are asked to aggregate.
 */
public final class InputFieldValidator {
  /** Prefix of every message. */
  static final String ORIGIN = "InputFieldValidator";

  /** Utility class. */
  private InputFieldValidator() {}

  /**
   * @param field the input field.
   * @throws AggregateConfigurationException if the field is not nullable.
   */
  public static void ensureFieldIsNullable(final FieldInfo field) throws AggregateConfigurationException {
    if (!field.isNullable()) {
      throw new AggregateConfigurationException(ORIGIN, "Aggregate must only be requested for nullable fields.");
    }
  }

  /**
   * @param field the input field.
   * @throws AggregateConfigurationException if the field is not of a numeric type.
   */
  public static void ensureFieldIsNumeric(final FieldInfo field) throws AggregateConfigurationException {
    if (!field.getDatatype().isNumeric()) {
      throw new AggregateConfigurationException(ORIGIN, "Aggregate is not supported for datatype "
          + field.getDatatype() + ".");
    }
  }

  /**
   * @param field the input field.
   * @throws AggregateConfigurationException if the field is neither numeric nor a string.
   */
  public static void ensureFieldIsComparable(final FieldInfo field) throws AggregateConfigurationException {
    if (!field.getDatatype().isNumeric() && !field.getDatatype().isString()) {
      throw new AggregateConfigurationException(ORIGIN, "Aggregate is not supported for datatype "
          + field.getDatatype() + ".");
    }
  }

  /**
   * Fixed numeric values only: strings may be var sized or have several characters per cell.
   *
   * @param field the input field.
   * @throws AggregateConfigurationException if a non-string field is var sized or has several values per cell.
   */
  public static void ensureFieldIsSingleValue(final FieldInfo field) throws AggregateConfigurationException {
    if (field.getDatatype().isString()) {
      return;
    }
    if (field.isVarSized()) {
      throw new AggregateConfigurationException(ORIGIN,
          "Aggregate is not supported for var sized non-string fields.");
    }
    if (field.getCellValNum() != 1) {
      throw new AggregateConfigurationException(ORIGIN,
          "Aggregate is not supported for non-string fields with cell_val_num greater than one.");
    }
  }

  /**
   * @param field the input field.
   * @return true if the field holds variable-length values.
   */
  static boolean isVarNum(final FieldInfo field) {
    return field.getCellValNum() == ArrayAggConstants.VAR_NUM;
  }
}

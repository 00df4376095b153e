package edu.washington.escience.arrayagg.operator.agg;

import java.util.Map;

import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.InvalidOutputBufferException;
import edu.washington.escience.arrayagg.storage.QueryBuffer;

/**
 * Checks on the destination a user binds for an aggregate. Each aggregator composes the checks that fit its result.
 */
public final class OutputBufferValidator {
  /** Prefix of every message. */
  static final String ORIGIN = "OutputBufferValidator";

  /** Utility class. */
  private OutputBufferValidator() {}

  /**
   * @param outputName the output field name.
   * @param buffers the destinations.
   * @return the destination of the output field.
   * @throws InvalidOutputBufferException if there is none.
   */
  public static QueryBuffer ensureBufferExists(final String outputName, final Map<String, QueryBuffer> buffers)
      throws InvalidOutputBufferException {
    QueryBuffer buffer = buffers.get(outputName);
    if (buffer == null) {
      throw new InvalidOutputBufferException(ORIGIN, "Result buffer doesn't exist.");
    }
    if (buffer.buffer() == null) {
      throw new InvalidOutputBufferException(ORIGIN, "Aggregate must have a fixed size buffer.");
    }
    return buffer;
  }

  /**
   * A fixed result of {@code size} bytes.
   *
   * @param buffer the destination.
   * @param size bytes of the result.
   * @throws InvalidOutputBufferException on a var buffer or a fixed buffer of another size.
   */
  public static void ensureFixedBuffer(final QueryBuffer buffer, final long size)
      throws InvalidOutputBufferException {
    if (buffer.bufferVar() != null) {
      throw new InvalidOutputBufferException(ORIGIN, "Aggregate must not have a var buffer.");
    }
    if (buffer.originalBufferSize() != size) {
      throw new InvalidOutputBufferException(ORIGIN, "Aggregate fixed size buffer should be for one element only.");
    }
  }

  /**
   * A variable-length result: one offset plus the value bytes.
   *
   * @param buffer the destination.
   * @param field the aggregated field.
   * @throws InvalidOutputBufferException on a wrong offset buffer, no var buffer, or a field that is not var num.
   */
  public static void ensureVarBuffer(final QueryBuffer buffer, final FieldInfo field)
      throws InvalidOutputBufferException {
    if (buffer.originalBufferSize() != ArrayAggConstants.CELL_VAR_OFFSET_SIZE) {
      throw new InvalidOutputBufferException(ORIGIN, "Aggregate fixed size buffer should be for one element only.");
    }
    if (buffer.bufferVar() == null) {
      throw new InvalidOutputBufferException(ORIGIN, "Var sized aggregates must have a var buffer.");
    }
    if (!InputFieldValidator.isVarNum(field)) {
      throw new InvalidOutputBufferException(ORIGIN, "Var sized aggregates should have var num cell val num.");
    }
  }

  /**
   * @param buffer the destination.
   * @param nullable whether the result carries a validity byte.
   * @throws InvalidOutputBufferException if the validity buffer does not match the nullability.
   */
  public static void ensureValidity(final QueryBuffer buffer, final boolean nullable)
      throws InvalidOutputBufferException {
    boolean hasValidity = buffer.validityBuffer() != null;
    if (nullable) {
      if (!hasValidity) {
        throw new InvalidOutputBufferException(ORIGIN,
            "Aggregate for nullable attributes must have a validity buffer.");
      }
      if (buffer.originalValiditySize() != ArrayAggConstants.CELL_VALIDITY_SIZE) {
        throw new InvalidOutputBufferException(ORIGIN, "Aggregate validity vector should be for one element only.");
      }
    } else if (hasValidity) {
      throw new InvalidOutputBufferException(ORIGIN,
          "Aggregate for non nullable attributes must not have a validity buffer.");
    }
  }

  /**
   * @param buffer the destination of a count.
   * @throws InvalidOutputBufferException if it has a validity buffer.
   */
  public static void ensureNoValidityForCount(final QueryBuffer buffer) throws InvalidOutputBufferException {
    if (buffer.validityBuffer() != null) {
      throw new InvalidOutputBufferException(ORIGIN, "Count aggregates must not have a validity buffer.");
    }
  }
}

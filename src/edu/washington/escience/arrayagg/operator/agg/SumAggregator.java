package edu.washington.escience.arrayagg.operator.agg;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.math.LongMath;
import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.InvalidOutputBufferException;
import edu.washington.escience.arrayagg.ValueKind;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;

/**
 * SUM over a numeric field. Integers are summed in 64 bits keeping their signedness, floating point values as doubles.
 * Any overflow, in either direction, is sticky: the aggregate stops changing and reports the maximum of its output
 * type.
 */
@ThreadSafe
public final class SumAggregator implements Aggregator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(SumAggregator.class);

  /** The summed field. */
  private final FieldInfo field;
  /** How the values are summed. */
  private final ValueKind kind;

  /** Integral sum, signed or unsigned according to {@link #kind}. */
  @GuardedBy("this")
  private long longSum;
  /** Floating point sum. */
  @GuardedBy("this")
  private double doubleSum;
  /** Number of summed cells. */
  @GuardedBy("this")
  private long count;
  /** Set once a non-null value was summed. */
  @GuardedBy("this")
  private boolean valid;
  /** Sticky overflow flag. Written under the lock, read without it to skip the scan. */
  private volatile boolean overflowed;

  /**
   * @param field the summed field.
   * @throws AggregateConfigurationException if the field is not a single-valued numeric field.
   */
  public SumAggregator(final FieldInfo field) throws AggregateConfigurationException {
    this.field = Objects.requireNonNull(field, "field");
    InputFieldValidator.ensureFieldIsNumeric(field);
    InputFieldValidator.ensureFieldIsSingleValue(field);
    kind = field.getDatatype().getValueKind();
  }

  @Override
  public AggregationOp aggregationOp() {
    return AggregationOp.SUM;
  }

  @Override
  public FieldInfo fieldInfo() {
    return field;
  }

  @Override
  public String fieldName() {
    return field.getName();
  }

  @Override
  public boolean aggregationVarSized() {
    return false;
  }

  @Override
  public boolean aggregationNullable() {
    return field.isNullable();
  }

  @Override
  public boolean needRecomputeOnOverflow() {
    return true;
  }

  @Override
  public Datatype outputDatatype() {
    return field.getDatatype().getSumDatatype();
  }

  @Override
  public void validateOutputBuffer(final String outputName, final Map<String, QueryBuffer> buffers)
      throws InvalidOutputBufferException {
    QueryBuffer buffer = OutputBufferValidator.ensureBufferExists(outputName, buffers);
    OutputBufferValidator.ensureFixedBuffer(buffer, ArrayAggConstants.AGGREGATE_RESULT_SIZE);
    OutputBufferValidator.ensureValidity(buffer, field.isNullable());
  }

  @Override
  public void aggregateData(final AggregateBuffer input) {
    if (overflowed) {
      return;
    }
    final Datatype datatype = field.getDatatype();
    final ByteBuffer data = input.fixedData();
    final long[] partialLong = new long[1];
    final double[] partialDouble = new double[1];
    long cells;
    try {
      switch (kind) {
        case SIGNED_INTEGER:
          cells = AggregateKernel.aggregateWithCount(input, field.isNullable(), (cell, weight) -> {
            partialLong[0] =
                LongMath.checkedAdd(partialLong[0], LongMath.checkedMultiply(datatype.getLong(data, cell), weight));
          });
          break;
        case UNSIGNED_INTEGER:
          cells = AggregateKernel.aggregateWithCount(input, field.isNullable(), (cell, weight) -> {
            partialLong[0] =
                checkedUnsignedAdd(partialLong[0], checkedUnsignedMultiply(datatype.getLong(data, cell), weight));
          });
          break;
        case FLOATING_POINT:
          cells = AggregateKernel.aggregateWithCount(input, field.isNullable(), (cell, weight) -> {
            partialDouble[0] = checkedDoubleAdd(partialDouble[0], datatype.getDouble(data, cell) * weight);
          });
          break;
        default:
          throw new IllegalStateException("SUM over " + kind);
      }
    } catch (ArithmeticException e) {
      // Only a selected cell can overflow the partial sum.
      markOverflowed(e, true);
      return;
    }
    merge(partialLong[0], partialDouble[0], cells);
  }

  @Override
  public void aggregateTileWithFragMd(final TileMetadata tileMetadata) {
    if (overflowed) {
      return;
    }
    merge(tileMetadata.sumAsLong(), tileMetadata.sumAsDouble(), tileMetadata.nonNullCount());
  }

  /**
   * Add a partial result to the accumulated one as one atomic step.
   *
   * @param partialLong the integral partial sum.
   * @param partialDouble the floating point partial sum.
   * @param cells the number of cells in the partial sum.
   */
  private synchronized void merge(final long partialLong, final double partialDouble, final long cells) {
    if (overflowed) {
      return;
    }
    try {
      switch (kind) {
        case SIGNED_INTEGER:
          longSum = LongMath.checkedAdd(longSum, partialLong);
          break;
        case UNSIGNED_INTEGER:
          longSum = checkedUnsignedAdd(longSum, partialLong);
          break;
        default:
          doubleSum = checkedDoubleAdd(doubleSum, partialDouble);
          break;
      }
      count = LongMath.checkedAdd(count, cells);
    } catch (ArithmeticException e) {
      markOverflowed(e, cells > 0);
      return;
    }
    if (cells > 0) {
      valid = true;
    }
  }

  /**
   * @param cause the overflow.
   * @param selected true if a non-null cell took part in the overflowing sum.
   */
  private synchronized void markOverflowed(final ArithmeticException cause, final boolean selected) {
    if (selected) {
      valid = true;
    }
    if (!overflowed) {
      LOGGER.debug("SUM of {} overflowed, result is pinned to the maximum of {}", field.getName(), outputDatatype(),
          cause);
    }
    overflowed = true;
  }

  @Override
  public synchronized void copyToUserBuffer(final String outputName, final Map<String, QueryBuffer> buffers) {
    QueryBuffer buffer = buffers.get(outputName);
    ByteBuffer dest = buffer.buffer();
    switch (kind) {
      case SIGNED_INTEGER:
        Datatype.INT64.putLong(dest, overflowed ? Long.MAX_VALUE : longSum);
        break;
      case UNSIGNED_INTEGER:
        Datatype.UINT64.putLong(dest, overflowed ? UnsignedLong.MAX_VALUE.longValue() : longSum);
        break;
      default:
        Datatype.FLOAT64.putDouble(dest, overflowed ? Double.MAX_VALUE : doubleSum);
        break;
    }
    buffer.setBufferSize(ArrayAggConstants.AGGREGATE_RESULT_SIZE);
    if (field.isNullable()) {
      buffer.validityBuffer().put(0, (byte) (valid ? 1 : 0));
      buffer.setValiditySize(ArrayAggConstants.CELL_VALIDITY_SIZE);
    }
  }

  /** @return true once the sum overflowed. */
  public boolean isOverflowed() {
    return overflowed;
  }

  /** @return number of summed cells. */
  public synchronized long getCount() {
    return count;
  }

  /**
   * @param a an unsigned value.
   * @param b an unsigned value.
   * @return a + b.
   * @throws ArithmeticException if the sum does not fit 64 unsigned bits.
   */
  static long checkedUnsignedAdd(final long a, final long b) {
    long sum = a + b;
    if (UnsignedLongs.compare(sum, a) < 0) {
      throw new ArithmeticException("unsigned overflow");
    }
    return sum;
  }

  /**
   * @param a an unsigned value.
   * @param b an unsigned value.
   * @return a * b.
   * @throws ArithmeticException if the product does not fit 64 unsigned bits.
   */
  static long checkedUnsignedMultiply(final long a, final long b) {
    if (b != 0 && UnsignedLongs.compare(a, UnsignedLongs.divide(-1L, b)) > 0) {
      throw new ArithmeticException("unsigned overflow");
    }
    return a * b;
  }

  /**
   * NaN operands are data and propagate into the sum.
   *
   * @param a a finite value or NaN.
   * @param b a value.
   * @return a + b.
   * @throws ArithmeticException if the sum is infinite.
   */
  static double checkedDoubleAdd(final double a, final double b) {
    double sum = a + b;
    if (Double.isInfinite(sum)) {
      throw new ArithmeticException("floating point overflow");
    }
    return sum;
  }
}

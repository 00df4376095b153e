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

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.InvalidOutputBufferException;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;

/**
 * MEAN over a numeric field, computed in double precision. The mean of no cells is NaN with validity 0. A sum that
 * stops being finite is sticky and reported as {@link Double#MAX_VALUE}.
 */
@ThreadSafe
public final class MeanAggregator implements Aggregator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(MeanAggregator.class);

  /** The averaged field. */
  private final FieldInfo field;

  /** Sum of the averaged values. */
  @GuardedBy("this")
  private double sum;
  /** Number of averaged cells. */
  @GuardedBy("this")
  private long count;
  /** Set once a non-null value was averaged, including one that overflowed the sum. */
  @GuardedBy("this")
  private boolean valid;
  /** Sticky overflow flag. Written under the lock, read without it to skip the scan. */
  private volatile boolean overflowed;

  /**
   * @param field the averaged field.
   * @throws AggregateConfigurationException if the field is not a single-valued numeric field.
   */
  public MeanAggregator(final FieldInfo field) throws AggregateConfigurationException {
    this.field = Objects.requireNonNull(field, "field");
    InputFieldValidator.ensureFieldIsNumeric(field);
    InputFieldValidator.ensureFieldIsSingleValue(field);
  }

  @Override
  public AggregationOp aggregationOp() {
    return AggregationOp.MEAN;
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
    return Datatype.FLOAT64;
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
    final double[] partial = new double[1];
    long cells;
    try {
      cells = AggregateKernel.aggregateWithCount(input, field.isNullable(), (cell, weight) -> {
        partial[0] = SumAggregator.checkedDoubleAdd(partial[0], datatype.getDouble(data, cell) * weight);
      });
    } catch (ArithmeticException e) {
      markOverflowed(e, true);
      return;
    }
    merge(partial[0], cells);
  }

  @Override
  public void aggregateTileWithFragMd(final TileMetadata tileMetadata) {
    if (overflowed) {
      return;
    }
    double tileSum;
    switch (field.getDatatype().getValueKind()) {
      case SIGNED_INTEGER:
        tileSum = tileMetadata.sumAsLong();
        break;
      case UNSIGNED_INTEGER:
        tileSum = UnsignedLong.fromLongBits(tileMetadata.sumAsLong()).doubleValue();
        break;
      default:
        tileSum = tileMetadata.sumAsDouble();
        break;
    }
    merge(tileSum, tileMetadata.nonNullCount());
  }

  /**
   * Add a partial result to the accumulated one as one atomic step.
   *
   * @param partial the partial sum.
   * @param cells the number of cells in the partial sum.
   */
  private synchronized void merge(final double partial, final long cells) {
    if (overflowed) {
      return;
    }
    try {
      sum = SumAggregator.checkedDoubleAdd(sum, partial);
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
      LOGGER.debug("MEAN of {} overflowed, result is pinned to Double.MAX_VALUE", field.getName(), cause);
    }
    overflowed = true;
  }

  @Override
  public synchronized void copyToUserBuffer(final String outputName, final Map<String, QueryBuffer> buffers) {
    QueryBuffer buffer = buffers.get(outputName);
    double mean;
    if (overflowed) {
      mean = Double.MAX_VALUE;
    } else if (count == 0) {
      mean = Double.NaN;
    } else {
      mean = sum / count;
    }
    Datatype.FLOAT64.putDouble(buffer.buffer(), mean);
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
}

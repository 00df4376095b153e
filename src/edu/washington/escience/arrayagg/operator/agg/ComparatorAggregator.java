package edu.washington.escience.arrayagg.operator.agg;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.washington.escience.arrayagg.AggregateCapacityException;
import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.InvalidOutputBufferException;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;

/**
 * Keeps the extreme value of a field under some order. Each scan finds the extreme of its own buffer first, then
 * compares it with the kept value while holding the aggregator's monitor.
 *
 * @param <T> the Java type holding one value.
 */
@ThreadSafe
public abstract class ComparatorAggregator<T> implements Aggregator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(ComparatorAggregator.class);

  /** The aggregated field. */
  private final FieldInfo field;
  /** Reads, orders and writes the values. */
  private final ValueType<T> valueType;
  /** Which extreme is kept. */
  private final ComparatorOp op;

  /** The kept value, null until a cell was aggregated. */
  @GuardedBy("this")
  @Nullable
  private T value;
  /** Set once a non-null value was aggregated. */
  @GuardedBy("this")
  private boolean valid;

  /**
   * @param field the aggregated field.
   * @param valueType reads, orders and writes the values.
   * @param op which extreme is kept.
   * @throws AggregateConfigurationException if the field cannot be aggregated this way.
   */
  protected ComparatorAggregator(final FieldInfo field, final ValueType<T> valueType, final ComparatorOp op)
      throws AggregateConfigurationException {
    this.field = Objects.requireNonNull(field, "field");
    this.valueType = Objects.requireNonNull(valueType, "valueType");
    this.op = Objects.requireNonNull(op, "op");
    InputFieldValidator.ensureFieldIsComparable(field);
    InputFieldValidator.ensureFieldIsSingleValue(field);
    Preconditions.checkArgument(valueType.getValueKind() == field.getDatatype().getValueKind(),
        "%s values cannot be read as %s", field.getDatatype(), valueType.getValueKind());
  }

  @Override
  public AggregationOp aggregationOp() {
    return op == ComparatorOp.MIN ? AggregationOp.MIN : AggregationOp.MAX;
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
    return field.isVarSized();
  }

  @Override
  public boolean aggregationNullable() {
    return field.isNullable();
  }

  @Override
  public boolean needRecomputeOnOverflow() {
    return false;
  }

  @Override
  public Datatype outputDatatype() {
    return field.getDatatype();
  }

  /** @return which extreme is kept. */
  public ComparatorOp getOp() {
    return op;
  }

  @Override
  public void validateOutputBuffer(final String outputName, final Map<String, QueryBuffer> buffers)
      throws InvalidOutputBufferException {
    QueryBuffer buffer = OutputBufferValidator.ensureBufferExists(outputName, buffers);
    if (field.isVarSized()) {
      OutputBufferValidator.ensureVarBuffer(buffer, field);
    } else {
      OutputBufferValidator.ensureFixedBuffer(buffer, valueType.fixedResultSize(field));
    }
    OutputBufferValidator.ensureValidity(buffer, field.isNullable());
  }

  @Override
  public void aggregateData(final AggregateBuffer input) {
    final Extreme<T> extreme = new Extreme<>();
    long cells = AggregateKernel.aggregateWithCount(input, field.isNullable(), (cell, weight) -> {
      T candidate = valueType.valueAt(input, cell, field);
      if (extreme.value == null || op.prefers(valueType.compare(candidate, extreme.value))) {
        extreme.value = candidate;
      }
    });
    LOGGER.trace("{} of {} scanned [{}, {}), {} cells selected", op, field.getName(), input.minCell(),
        input.maxCell(), cells);
    updateValue(extreme.value, cells);
  }

  @Override
  public void aggregateTileWithFragMd(final TileMetadata tileMetadata) {
    long cells = tileMetadata.nonNullCount();
    ByteBuffer bytes = op == ComparatorOp.MIN ? tileMetadata.min() : tileMetadata.max();
    if (cells == 0 || bytes == null) {
      return;
    }
    updateValue(valueType.fromMetadata(bytes, field), cells);
  }

  /**
   * Replace the kept value if the candidate is preferred.
   *
   * @param candidate the extreme of some cells, null if there were none.
   * @param count the number of cells the candidate was drawn from.
   */
  synchronized void updateValue(@Nullable final T candidate, final long count) {
    if (count <= 0 || candidate == null) {
      return;
    }
    if (value == null || op.prefers(valueType.compare(candidate, value))) {
      value = candidate;
    }
    if (field.isNullable()) {
      valid = true;
    }
  }

  @Override
  public synchronized void copyToUserBuffer(final String outputName, final Map<String, QueryBuffer> buffers)
      throws AggregateCapacityException {
    QueryBuffer buffer = buffers.get(outputName);
    valueType.write(value, field, buffer);
    if (field.isNullable()) {
      buffer.validityBuffer().put(0, (byte) (valid ? 1 : 0));
      buffer.setValiditySize(ArrayAggConstants.CELL_VALIDITY_SIZE);
    }
  }

  /**
   * The extreme of one scan.
   *
   * @param <T> the Java type holding one value.
   */
  private static final class Extreme<T> {
    /** The extreme so far, null before the first selected cell. */
    private T value;
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import java.nio.ByteBuffer;
import java.util.Comparator;

import com.google.common.primitives.UnsignedBytes;

import edu.washington.escience.arrayagg.AggregateCapacityException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.ValueKind;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;

/**
 * Strings, fixed or variable length, held as their bytes and ordered byte-wise as unsigned values. A shorter string
 * orders before any longer string it is a prefix of.
 */
public enum StringValueType implements ValueType<byte[]> {
  /** The only instance. */
  INSTANCE;

  /** Reported by capacity errors. */
  static final String ORIGIN = "MinMaxAggregator";

  /** Unsigned lexicographical order. */
  private static final Comparator<byte[]> ORDER = UnsignedBytes.lexicographicalComparator();

  @Override
  public ValueKind getValueKind() {
    return ValueKind.STRING;
  }

  @Override
  public byte[] valueAt(final AggregateBuffer input, final int cell, final FieldInfo field) {
    if (field.isVarSized()) {
      return input.varValue(cell);
    }
    return input.fixedValue(cell, field.getCellSize());
  }

  @Override
  public byte[] fromMetadata(final ByteBuffer bytes, final FieldInfo field) {
    ByteBuffer view = bytes.duplicate();
    byte[] value = new byte[view.remaining()];
    view.get(value);
    return value;
  }

  @Override
  public int compare(final byte[] left, final byte[] right) {
    return ORDER.compare(left, right);
  }

  @Override
  public long fixedResultSize(final FieldInfo field) {
    return field.getCellSize();
  }

  @Override
  public void write(final byte[] value, final FieldInfo field, final QueryBuffer dest)
      throws AggregateCapacityException {
    if (field.isVarSized()) {
      Datatype.UINT64.putLong(dest.buffer(), 0);
      dest.setBufferSize(ArrayAggConstants.CELL_VAR_OFFSET_SIZE);
      if (value != null) {
        if (dest.originalBufferVarSize() < value.length) {
          throw new AggregateCapacityException(ORIGIN, field.getName(), value.length);
        }
        putAtStart(dest.bufferVar(), value);
      }
      dest.setBufferVarSize(value == null ? 0 : value.length);
    } else if (value != null) {
      putAtStart(dest.buffer(), value);
      dest.setBufferSize(value.length);
    }
  }

  /**
   * @param dest a destination buffer.
   * @param value bytes to copy to its start.
   */
  private static void putAtStart(final ByteBuffer dest, final byte[] value) {
    ByteBuffer view = dest.duplicate();
    view.clear();
    view.put(value);
  }
}

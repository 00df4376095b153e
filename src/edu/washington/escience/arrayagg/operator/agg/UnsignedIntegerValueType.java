package edu.washington.escience.arrayagg.operator.agg;

import java.nio.ByteBuffer;

import com.google.common.primitives.UnsignedLong;

import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.ValueKind;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;

/** Unsigned integers of any width. */
public enum UnsignedIntegerValueType implements ValueType<UnsignedLong> {
  /** The only instance. */
  INSTANCE;

  @Override
  public ValueKind getValueKind() {
    return ValueKind.UNSIGNED_INTEGER;
  }

  @Override
  public UnsignedLong valueAt(final AggregateBuffer input, final int cell, final FieldInfo field) {
    return UnsignedLong.fromLongBits(field.getDatatype().getLong(input.fixedData(), cell));
  }

  @Override
  public UnsignedLong fromMetadata(final ByteBuffer bytes, final FieldInfo field) {
    return UnsignedLong.fromLongBits(field.getDatatype().getLong(bytes, 0));
  }

  @Override
  public int compare(final UnsignedLong left, final UnsignedLong right) {
    return left.compareTo(right);
  }

  @Override
  public long fixedResultSize(final FieldInfo field) {
    return field.getDatatype().size();
  }

  @Override
  public void write(final UnsignedLong value, final FieldInfo field, final QueryBuffer dest) {
    field.getDatatype().putLong(dest.buffer(), value == null ? 0 : value.longValue());
    dest.setBufferSize(field.getDatatype().size());
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import java.nio.ByteBuffer;

import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.ValueKind;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;

/** Signed integers of any width, held as sign-extended longs. */
public enum SignedIntegerValueType implements ValueType<Long> {
  /** The only instance. */
  INSTANCE;

  @Override
  public ValueKind getValueKind() {
    return ValueKind.SIGNED_INTEGER;
  }

  @Override
  public Long valueAt(final AggregateBuffer input, final int cell, final FieldInfo field) {
    return field.getDatatype().getLong(input.fixedData(), cell);
  }

  @Override
  public Long fromMetadata(final ByteBuffer bytes, final FieldInfo field) {
    return field.getDatatype().getLong(bytes, 0);
  }

  @Override
  public int compare(final Long left, final Long right) {
    return Long.compare(left, right);
  }

  @Override
  public long fixedResultSize(final FieldInfo field) {
    return field.getDatatype().size();
  }

  @Override
  public void write(final Long value, final FieldInfo field, final QueryBuffer dest) {
    field.getDatatype().putLong(dest.buffer(), value == null ? 0 : value);
    dest.setBufferSize(field.getDatatype().size());
  }
}

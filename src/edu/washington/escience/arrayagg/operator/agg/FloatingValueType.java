package edu.washington.escience.arrayagg.operator.agg;

import java.nio.ByteBuffer;

import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.ValueKind;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;

/** 32 and 64 bit floating point values, held as doubles. */
public enum FloatingValueType implements ValueType<Double> {
  /** The only instance. */
  INSTANCE;

  @Override
  public ValueKind getValueKind() {
    return ValueKind.FLOATING_POINT;
  }

  @Override
  public Double valueAt(final AggregateBuffer input, final int cell, final FieldInfo field) {
    return field.getDatatype().getDouble(input.fixedData(), cell);
  }

  @Override
  public Double fromMetadata(final ByteBuffer bytes, final FieldInfo field) {
    return field.getDatatype().getDouble(bytes, 0);
  }

  /**
   * NaN compares equal to every value, so a NaN cell never replaces the kept MIN or MAX. Other values are ordered by
   * {@link Double#compare}.
   */
  @Override
  public int compare(final Double left, final Double right) {
    if (left.isNaN() || right.isNaN()) {
      return 0;
    }
    return Double.compare(left, right);
  }

  @Override
  public long fixedResultSize(final FieldInfo field) {
    return field.getDatatype().size();
  }

  @Override
  public void write(final Double value, final FieldInfo field, final QueryBuffer dest) {
    field.getDatatype().putDouble(dest.buffer(), value == null ? 0 : value);
    dest.setBufferSize(field.getDatatype().size());
  }
}

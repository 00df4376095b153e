package edu.washington.escience.arrayagg;

import java.nio.ByteBuffer;

import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedInteger;

/**
 * The scalar types a tile attribute can hold. Cells are stored little-endian, one fixed-width value after another, so
 * every constant knows how to read cell {@code index} of a {@link ByteBuffer} and how to write a single value back.
 *
 * Integral values are exchanged as {@code long} bit patterns: sign-extended for signed types and zero-extended for
 * unsigned ones. {@link #UINT64} therefore uses the full unsigned range of the {@code long}.
 */
public enum Datatype {
  /**
   * 8-bit signed integer.
   */
  INT8(Byte.BYTES, ValueKind.SIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return data.get(index * size());
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.put(0, (byte) value);
    }
  },

  /**
   * 8-bit unsigned integer.
   */
  UINT8(Byte.BYTES, ValueKind.UNSIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return Byte.toUnsignedLong(data.get(index * size()));
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.put(0, (byte) value);
    }
  },

  /**
   * 16-bit signed integer.
   */
  INT16(Short.BYTES, ValueKind.SIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return data.getShort(index * size());
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.putShort(0, (short) value);
    }
  },

  /**
   * 16-bit unsigned integer.
   */
  UINT16(Short.BYTES, ValueKind.UNSIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return Short.toUnsignedLong(data.getShort(index * size()));
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.putShort(0, (short) value);
    }
  },

  /**
   * 32-bit signed integer.
   */
  INT32(Integer.BYTES, ValueKind.SIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return data.getInt(index * size());
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.putInt(0, (int) value);
    }
  },

  /**
   * 32-bit unsigned integer.
   */
  UINT32(Integer.BYTES, ValueKind.UNSIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return UnsignedInteger.fromIntBits(data.getInt(index * size())).longValue();
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.putInt(0, (int) value);
    }
  },

  /**
   * 64-bit signed integer.
   */
  INT64(Long.BYTES, ValueKind.SIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return data.getLong(index * size());
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.putLong(0, value);
    }
  },

  /**
   * 64-bit unsigned integer.
   */
  UINT64(Long.BYTES, ValueKind.UNSIGNED_INTEGER) {
    @Override
    public long getLong(final ByteBuffer data, final int index) {
      return data.getLong(index * size());
    }

    @Override
    public double getDouble(final ByteBuffer data, final int index) {
      return UnsignedLong.fromLongBits(getLong(data, index)).doubleValue();
    }

    @Override
    public void putLong(final ByteBuffer dest, final long value) {
      dest.putLong(0, value);
    }
  },

  /**
   * 32-bit IEEE-754 value.
   */
  FLOAT32(Float.BYTES, ValueKind.FLOATING_POINT) {
    @Override
    public double getDouble(final ByteBuffer data, final int index) {
      return data.getFloat(index * size());
    }

    @Override
    public void putDouble(final ByteBuffer dest, final double value) {
      dest.putFloat(0, (float) value);
    }
  },

  /**
   * 64-bit IEEE-754 value.
   */
  FLOAT64(Double.BYTES, ValueKind.FLOATING_POINT) {
    @Override
    public double getDouble(final ByteBuffer data, final int index) {
      return data.getDouble(index * size());
    }

    @Override
    public void putDouble(final ByteBuffer dest, final double value) {
      dest.putDouble(0, value);
    }
  },

  /**
   * Single byte character.
   */
  CHAR(Byte.BYTES, ValueKind.STRING),

  /**
   * ASCII string, one byte per character.
   */
  STRING_ASCII(Byte.BYTES, ValueKind.STRING),

  /**
   * UTF-8 encoded string. Compared byte-wise.
   */
  STRING_UTF8(Byte.BYTES, ValueKind.STRING),

  /**
   * Opaque bytes.
   */
  BLOB(Byte.BYTES, ValueKind.UNSUPPORTED),

  /**
   * Boolean stored as one byte.
   */
  BOOL(Byte.BYTES, ValueKind.UNSUPPORTED);

  /** Width in bytes of one value. */
  private final int size;
  /** Representation the aggregators use for this type. */
  private final ValueKind valueKind;

  /**
   * @param size width in bytes of one value.
   * @param valueKind representation the aggregators use for this type.
   */
  Datatype(final int size, final ValueKind valueKind) {
    this.size = size;
    this.valueKind = valueKind;
  }

  /** @return width in bytes of one value. */
  public int size() {
    return size;
  }

  /** @return representation the aggregators use for this type. */
  public ValueKind getValueKind() {
    return valueKind;
  }

  /** @return true if SUM and MEAN can be computed over this type. */
  public boolean isNumeric() {
    return valueKind.isNumeric();
  }

  /** @return true if this type holds character data. */
  public boolean isString() {
    return valueKind == ValueKind.STRING;
  }

  /**
   * Read one integral value.
   *
   * @param data the cells, little-endian.
   * @param index the cell index.
   * @return the value as a long bit pattern, sign-extended or zero-extended according to the type.
   */
  public long getLong(final ByteBuffer data, final int index) {
    throw new UnsupportedOperationException(this + " has no integral value");
  }

  /**
   * Read one value as a double.
   *
   * @param data the cells, little-endian.
   * @param index the cell index.
   * @return the value.
   */
  public double getDouble(final ByteBuffer data, final int index) {
    if (valueKind == ValueKind.SIGNED_INTEGER || valueKind == ValueKind.UNSIGNED_INTEGER) {
      return getLong(data, index);
    }
    throw new UnsupportedOperationException(this + " has no numeric value");
  }

  /**
   * Write one integral value at the start of {@code dest}, truncated to the width of this type.
   *
   * @param dest the destination.
   * @param value the value as a long bit pattern.
   */
  public void putLong(final ByteBuffer dest, final long value) {
    throw new UnsupportedOperationException(this + " has no integral value");
  }

  /**
   * Write one floating point value at the start of {@code dest}.
   *
   * @param dest the destination.
   * @param value the value.
   */
  public void putDouble(final ByteBuffer dest, final double value) {
    throw new UnsupportedOperationException(this + " has no floating point value");
  }

  /**
   * The type SUM produces for this input type: integers widen to 64 bits keeping their signedness, floating point
   * widens to {@link #FLOAT64}.
   *
   * @return the SUM output type.
   */
  public Datatype getSumDatatype() {
    switch (valueKind) {
      case SIGNED_INTEGER:
        return INT64;
      case UNSIGNED_INTEGER:
        return UINT64;
      case FLOATING_POINT:
        return FLOAT64;
      default:
        throw new UnsupportedOperationException("SUM is not defined for " + this);
    }
  }
}

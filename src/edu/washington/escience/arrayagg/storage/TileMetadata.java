package edu.washington.escience.arrayagg.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Statistics the storage layer keeps for a whole tile of one attribute. Lets an aggregator consume a fully selected
 * tile without scanning its cells.
 */
public final class TileMetadata {
  /** Number of cells in the tile. */
  private final long count;
  /** Number of null cells in the tile. */
  private final long nullCount;
  /** Bytes of the smallest non-null value. */
  @Nullable
  private final byte[] min;
  /** Bytes of the largest non-null value. */
  @Nullable
  private final byte[] max;
  /** Eight bytes holding the sum as an int64, uint64 or double. */
  private final byte[] sum;

  /**
   * @param count number of cells in the tile.
   * @param nullCount number of null cells in the tile.
   * @param min bytes of the smallest non-null value, little-endian for numbers.
   * @param max bytes of the largest non-null value, little-endian for numbers.
   * @param sum eight little-endian bytes holding the sum.
   */
  public TileMetadata(final long count, final long nullCount, @Nullable final byte[] min,
      @Nullable final byte[] max, final byte[] sum) {
    Preconditions.checkArgument(nullCount >= 0 && nullCount <= count, "null count %s out of range [0, %s]",
        nullCount, count);
    Preconditions.checkArgument(sum != null && sum.length == Long.BYTES, "sum must hold eight bytes");
    this.count = count;
    this.nullCount = nullCount;
    this.min = min == null ? null : min.clone();
    this.max = max == null ? null : max.clone();
    this.sum = sum.clone();
  }

  /**
   * Metadata of a numeric tile whose sum is integral.
   *
   * @param count number of cells.
   * @param nullCount number of null cells.
   * @param min encoded minimum.
   * @param max encoded maximum.
   * @param sum the sum bits.
   * @return the metadata.
   */
  public static TileMetadata withLongSum(final long count, final long nullCount, final byte[] min,
      final byte[] max, final long sum) {
    return new TileMetadata(count, nullCount, min, max,
        ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(0, sum).array());
  }

  /**
   * Metadata of a floating point tile.
   *
   * @param count number of cells.
   * @param nullCount number of null cells.
   * @param min encoded minimum.
   * @param max encoded maximum.
   * @param sum the sum.
   * @return the metadata.
   */
  public static TileMetadata withDoubleSum(final long count, final long nullCount, final byte[] min,
      final byte[] max, final double sum) {
    return new TileMetadata(count, nullCount, min, max,
        ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putDouble(0, sum).array());
  }

  /** @return number of cells in the tile. */
  public long count() {
    return count;
  }

  /** @return number of null cells in the tile. */
  public long nullCount() {
    return nullCount;
  }

  /** @return number of non-null cells in the tile. */
  public long nonNullCount() {
    return count - nullCount;
  }

  /** @return a little-endian view of the minimum, null if the tile holds no value. */
  @Nullable
  public ByteBuffer min() {
    return min == null ? null : ByteBuffer.wrap(min).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
  }

  /** @return a little-endian view of the maximum, null if the tile holds no value. */
  @Nullable
  public ByteBuffer max() {
    return max == null ? null : ByteBuffer.wrap(max).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
  }

  /** @return the sum as a signed or unsigned 64 bit pattern. */
  public long sumAsLong() {
    return ByteBuffer.wrap(sum).order(ByteOrder.LITTLE_ENDIAN).getLong(0);
  }

  /** @return the sum as a double. */
  public double sumAsDouble() {
    return ByteBuffer.wrap(sum).order(ByteOrder.LITTLE_ENDIAN).getDouble(0);
  }

  @Override
  public String toString() {
    return "TileMetadata[count=" + count + ", nullCount=" + nullCount + ", sum=" + Arrays.toString(sum) + "]";
  }
}

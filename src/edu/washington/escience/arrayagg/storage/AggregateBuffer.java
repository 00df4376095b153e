package edu.washington.escience.arrayagg.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import edu.washington.escience.arrayagg.ArrayAggConstants;

/**
 * A window {@code [minCell, maxCell)} over the decoded cells of one tile, handed to an aggregator for one call. All
 * buffers are little-endian and are read with absolute gets, so concurrent readers never disturb each other. Nothing
 * may hold on to an AggregateBuffer after the call it was passed to returns.
 */
public final class AggregateBuffer {
  /** First cell of the window. */
  private final int minCell;
  /** One past the last cell of the window. */
  private final int maxCell;
  /** Number of cells in the tile. */
  private final int cellNum;
  /** Values of a fixed field, or uint64 offsets of a var field. */
  private final ByteBuffer fixedData;
  /** Bytes of a var field. */
  @Nullable
  private final ByteBuffer varData;
  /** Number of valid bytes in {@link #varData}. */
  private final long varDataSize;
  /** One byte per cell, 0 meaning null. */
  @Nullable
  private final ByteBuffer validityData;
  /** True if {@link #bitmap} holds uint64 weights instead of uint8 flags. */
  private final boolean countBitmap;
  /** Per-cell selection weights. */
  @Nullable
  private final ByteBuffer bitmap;

  /**
   * @param minCell first cell of the window.
   * @param maxCell one past the last cell of the window.
   * @param cellNum number of cells in the tile.
   * @param fixedData values of a fixed field, or uint64 offsets of a var field.
   * @param varData bytes of a var field.
   * @param varDataSize number of valid bytes in varData.
   * @param validityData one byte per cell, 0 meaning null.
   * @param countBitmap true if bitmap holds uint64 weights instead of uint8 flags.
   * @param bitmap per-cell selection weights.
   */
  private AggregateBuffer(final int minCell, final int maxCell, final int cellNum, final ByteBuffer fixedData,
      @Nullable final ByteBuffer varData, final long varDataSize, @Nullable final ByteBuffer validityData,
      final boolean countBitmap, @Nullable final ByteBuffer bitmap) {
    Preconditions.checkArgument(minCell >= 0 && minCell <= maxCell && maxCell <= cellNum,
        "invalid cell window [%s, %s) for %s cells", minCell, maxCell, cellNum);
    this.minCell = minCell;
    this.maxCell = maxCell;
    this.cellNum = cellNum;
    this.fixedData = littleEndian(Objects.requireNonNull(fixedData, "fixedData"));
    this.varData = varData == null ? null : littleEndian(varData);
    this.varDataSize = varDataSize;
    this.validityData = validityData == null ? null : littleEndian(validityData);
    this.countBitmap = countBitmap;
    this.bitmap = bitmap == null ? null : littleEndian(bitmap);
  }

  /**
   * @param buffer a buffer supplied by the caller.
   * @return a little-endian view of it sharing its content.
   */
  private static ByteBuffer littleEndian(final ByteBuffer buffer) {
    return buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
  }

  /**
   * @param minCell first cell of the window.
   * @param maxCell one past the last cell of the window.
   * @param cellNum number of cells in the tile.
   * @param fixedData the cell values or offsets.
   * @return a builder for a buffer over this window.
   */
  public static Builder builder(final int minCell, final int maxCell, final int cellNum, final ByteBuffer fixedData) {
    return new Builder(minCell, maxCell, cellNum, fixedData);
  }

  /** @return first cell of the window. */
  public int minCell() {
    return minCell;
  }

  /** @return one past the last cell of the window. */
  public int maxCell() {
    return maxCell;
  }

  /** @return number of cells in the tile. */
  public int cellNum() {
    return cellNum;
  }

  /** @return values of a fixed field, or uint64 offsets of a var field. */
  public ByteBuffer fixedData() {
    return fixedData;
  }

  /** @return bytes of a var field, null for fixed fields. */
  @Nullable
  public ByteBuffer varData() {
    return varData;
  }

  /** @return number of valid bytes in the var data. */
  public long varDataSize() {
    return varDataSize;
  }

  /** @return validity bytes, null if the tile carries none. */
  @Nullable
  public ByteBuffer validityData() {
    return validityData;
  }

  /** @return true if the bitmap holds uint64 weights. */
  public boolean isCountBitmap() {
    return countBitmap;
  }

  /** @return the bitmap, null if every cell counts once. */
  @Nullable
  public ByteBuffer bitmap() {
    return bitmap;
  }

  /**
   * @param cell a cell of the tile.
   * @return true if the cell is not null. Always true when there is no validity data.
   */
  public boolean isValid(final int cell) {
    return validityData == null || validityData.get(cell) != 0;
  }

  /**
   * @param cell a cell of the tile.
   * @return how many times the cell counts: 1 without bitmap, else the bitmap entry.
   */
  public long weight(final int cell) {
    if (bitmap == null) {
      return 1;
    }
    if (countBitmap) {
      return bitmap.getLong(cell * Long.BYTES);
    }
    return Byte.toUnsignedLong(bitmap.get(cell));
  }

  /**
   * @param cell a cell of a var field.
   * @return the offset of its first byte in the var data.
   */
  public long varOffset(final int cell) {
    return fixedData.getLong(cell * ArrayAggConstants.CELL_VAR_OFFSET_SIZE);
  }

  /**
   * @param cell a cell of a var field.
   * @return the offset one past its last byte. The last cell of the tile ends at {@link #varDataSize()}.
   */
  public long varEnd(final int cell) {
    if (cell == cellNum - 1) {
      return varDataSize;
    }
    return varOffset(cell + 1);
  }

  /**
   * @param cell a cell of a var field.
   * @return a copy of its bytes.
   */
  public byte[] varValue(final int cell) {
    Preconditions.checkState(varData != null, "fixed size buffer has no var data");
    int start = (int) varOffset(cell);
    byte[] value = new byte[(int) (varEnd(cell) - start)];
    ByteBuffer view = varData.duplicate();
    view.position(start);
    view.get(value);
    return value;
  }

  /**
   * @param cell a cell of a fixed field.
   * @param cellSize bytes per cell.
   * @return a copy of its bytes.
   */
  public byte[] fixedValue(final int cell, final int cellSize) {
    byte[] value = new byte[cellSize];
    ByteBuffer view = fixedData.duplicate();
    view.position(cell * cellSize);
    view.get(value);
    return value;
  }

  /** Assembles an {@link AggregateBuffer}. */
  public static final class Builder {
    /** First cell of the window. */
    private final int minCell;
    /** One past the last cell of the window. */
    private final int maxCell;
    /** Number of cells in the tile. */
    private final int cellNum;
    /** Values or offsets. */
    private final ByteBuffer fixedData;
    /** Var bytes. */
    private ByteBuffer varData;
    /** Valid var bytes. */
    private long varDataSize;
    /** Validity bytes. */
    private ByteBuffer validityData;
    /** Bitmap kind. */
    private boolean countBitmap;
    /** Bitmap. */
    private ByteBuffer bitmap;

    /**
     * @param minCell first cell of the window.
     * @param maxCell one past the last cell of the window.
     * @param cellNum number of cells in the tile.
     * @param fixedData values or offsets.
     */
    private Builder(final int minCell, final int maxCell, final int cellNum, final ByteBuffer fixedData) {
      this.minCell = minCell;
      this.maxCell = maxCell;
      this.cellNum = cellNum;
      this.fixedData = fixedData;
    }

    /**
     * @param data var bytes.
     * @param size number of valid bytes.
     * @return this builder.
     */
    public Builder varData(final ByteBuffer data, final long size) {
      varData = data;
      varDataSize = size;
      return this;
    }

    /**
     * @param data one byte per cell, 0 meaning null.
     * @return this builder.
     */
    public Builder validity(final ByteBuffer data) {
      validityData = data;
      return this;
    }

    /**
     * @param data one uint8 flag per cell.
     * @return this builder.
     */
    public Builder booleanBitmap(final ByteBuffer data) {
      bitmap = data;
      countBitmap = false;
      return this;
    }

    /**
     * @param data one uint64 weight per cell.
     * @return this builder.
     */
    public Builder countBitmap(final ByteBuffer data) {
      bitmap = data;
      countBitmap = true;
      return this;
    }

    /** @return the buffer. */
    public AggregateBuffer build() {
      return new AggregateBuffer(minCell, maxCell, cellNum, fixedData, varData, varDataSize, validityData,
          countBitmap, bitmap);
    }
  }
}

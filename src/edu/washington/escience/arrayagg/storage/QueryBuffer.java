package edu.washington.escience.arrayagg.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import javax.annotation.Nullable;

/**
 * A destination the user binds for one output field of a query. Buffer capacities are recorded when the buffer is
 * bound. The reported sizes are written back when a result is copied in.
 */
public final class QueryBuffer {
  /** Fixed data destination. */
  @Nullable
  private final ByteBuffer buffer;
  /** Var data destination. */
  @Nullable
  private final ByteBuffer bufferVar;
  /** Validity destination. */
  @Nullable
  private final ByteBuffer validityBuffer;
  /** Capacity of {@link #buffer} at bind time. */
  private final long originalBufferSize;
  /** Capacity of {@link #bufferVar} at bind time. */
  private final long originalBufferVarSize;
  /** Capacity of {@link #validityBuffer} at bind time. */
  private final long originalValiditySize;
  /** Bytes written to {@link #buffer}. */
  private long bufferSize;
  /** Bytes written to {@link #bufferVar}. */
  private long bufferVarSize;
  /** Bytes written to {@link #validityBuffer}. */
  private long validitySize;

  /**
   * @param buffer fixed data destination.
   * @param bufferVar var data destination.
   * @param validityBuffer validity destination.
   */
  public QueryBuffer(@Nullable final ByteBuffer buffer, @Nullable final ByteBuffer bufferVar,
      @Nullable final ByteBuffer validityBuffer) {
    this.buffer = buffer == null ? null : buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    this.bufferVar = bufferVar;
    this.validityBuffer = validityBuffer;
    originalBufferSize = buffer == null ? 0 : buffer.capacity();
    originalBufferVarSize = bufferVar == null ? 0 : bufferVar.capacity();
    originalValiditySize = validityBuffer == null ? 0 : validityBuffer.capacity();
    bufferSize = originalBufferSize;
    bufferVarSize = originalBufferVarSize;
    validitySize = originalValiditySize;
  }

  /**
   * @param size capacity in bytes.
   * @return a destination with only a fixed buffer.
   */
  public static QueryBuffer fixed(final int size) {
    return new QueryBuffer(ByteBuffer.allocate(size), null, null);
  }

  /**
   * @param size capacity in bytes.
   * @return a destination with a fixed buffer and a one byte validity buffer.
   */
  public static QueryBuffer fixedNullable(final int size) {
    return new QueryBuffer(ByteBuffer.allocate(size), null, ByteBuffer.allocate(1));
  }

  /** @return fixed data destination. */
  @Nullable
  public ByteBuffer buffer() {
    return buffer;
  }

  /** @return var data destination. */
  @Nullable
  public ByteBuffer bufferVar() {
    return bufferVar;
  }

  /** @return validity destination. */
  @Nullable
  public ByteBuffer validityBuffer() {
    return validityBuffer;
  }

  /** @return capacity of the fixed buffer at bind time. */
  public long originalBufferSize() {
    return originalBufferSize;
  }

  /** @return capacity of the var buffer at bind time. */
  public long originalBufferVarSize() {
    return originalBufferVarSize;
  }

  /** @return capacity of the validity buffer at bind time. */
  public long originalValiditySize() {
    return originalValiditySize;
  }

  /** @return bytes written to the fixed buffer. */
  public long bufferSize() {
    return bufferSize;
  }

  /** @param size bytes written to the fixed buffer. */
  public void setBufferSize(final long size) {
    bufferSize = size;
  }

  /** @return bytes written to the var buffer. */
  public long bufferVarSize() {
    return bufferVarSize;
  }

  /** @param size bytes written to the var buffer. */
  public void setBufferVarSize(final long size) {
    bufferVarSize = size;
  }

  /** @return bytes written to the validity buffer. */
  public long validitySize() {
    return validitySize;
  }

  /** @param size bytes written to the validity buffer. */
  public void setValiditySize(final long size) {
    validitySize = size;
  }
}

package edu.washington.escience.arrayagg;

/**
 * The closed set of value representations the aggregators are specialized for. Every {@link Datatype} maps to exactly
 * one kind, and the aggregator factory dispatches on the kind.
 */
public enum ValueKind {
  /** Two's complement integers of 8, 16, 32 or 64 bits. Accumulated as a signed long. */
  SIGNED_INTEGER,
  /** Unsigned integers of 8, 16, 32 or 64 bits. Accumulated as an unsigned long. */
  UNSIGNED_INTEGER,
  /** 32 or 64 bit IEEE-754 values. Accumulated as a double. */
  FLOATING_POINT,
  /** Character data. Only MIN/MAX and the counts apply. */
  STRING,
  /** Types no value aggregate applies to. */
  UNSUPPORTED;

  /** @return true if SUM and MEAN apply to this kind. */
  public boolean isNumeric() {
    return this == SIGNED_INTEGER || this == UNSIGNED_INTEGER || this == FLOATING_POINT;
  }
}

package edu.washington.escience.arrayagg.query;

/**
 * Lifecycle of an {@link AggregateQuery}.
 */
public enum QueryStatus {
  /** Aggregates and buffers can still be bound. */
  UNINITIALIZED,
  /** Bindings validated, no step ran yet. */
  INITIALIZED,
  /** A read step is feeding the aggregators. */
  IN_PROGRESS,
  /** The last read step copied its results. */
  COMPLETED,
  /** A read step failed. Terminal. */
  FAILED;
}

package edu.washington.escience.arrayagg.operator.agg;

/**
 * Which selected cells a counting aggregate counts.
 */
public enum ValidityPolicy {
  /** Every selected cell, null or not. */
  NON_NULL,
  /** Only selected cells whose validity byte is 0. */
  NULL;
}

package edu.washington.escience.arrayagg;

/**
 * This class holds the constants for the aggregation engine.
 *
 */
public final class ArrayAggConstants {
  /**
   * Marks a field whose cells hold a variable number of values.
   */
  public static final int VAR_NUM = -1;

  /**
   * Size in bytes of one offset of a var-sized field.
   */
  public static final int CELL_VAR_OFFSET_SIZE = Long.BYTES;

  /**
   * Size in bytes of one validity value.
   */
  public static final int CELL_VALIDITY_SIZE = 1;

  /**
   * Size in bytes of the COUNT, NULL_COUNT, SUM and MEAN results.
   */
  public static final int AGGREGATE_RESULT_SIZE = Long.BYTES;

  /**
   * Field name reported by the COUNT aggregate, which has no input field.
   */
  public static final String COUNT_OF_ROWS = "__count";

  /**
   * Name of the default query channel.
   */
  public static final String DEFAULT_CHANNEL_NAME = "default";

  /**
   * Default ini file shipped with the engine.
   */
  public static final String DEFAULT_CONFIG_RESOURCE = "aggregates.cfg";

  /** Prevent construction of utility class. */
  private ArrayAggConstants() {}
}

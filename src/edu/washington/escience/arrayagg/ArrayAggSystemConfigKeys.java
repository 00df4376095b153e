package edu.washington.escience.arrayagg;

import edu.washington.escience.arrayagg.tool.AggregateConfiguration;

/**
 * Configuration keys of the aggregation engine. All keys live in section {@link #SECTION}.
 */
public final class ArrayAggSystemConfigKeys {

  /**
   * This is a purely static class.
   */
  private ArrayAggSystemConfigKeys() {}

  /** The ini section holding every key below. */
  public static final String SECTION = "aggregates";

  /** Number of threads a read step uses to feed tiles to the aggregators. */
  public static final String WORKER_THREADS = "worker_threads";

  /** Whether full tiles may be aggregated from their tile metadata instead of their cells. */
  public static final String USE_TILE_METADATA = "use_tile_metadata";

  /** How long a read step waits for its workers before failing. */
  public static final String STEP_TIMEOUT_SECONDS = "step_timeout_seconds";

  /** Default for {@link #USE_TILE_METADATA}. */
  public static final boolean DEFAULT_USE_TILE_METADATA = true;

  /** Default for {@link #STEP_TIMEOUT_SECONDS}. */
  public static final long DEFAULT_STEP_TIMEOUT_SECONDS = 600;

  /**
   * Fill in every key the configuration does not set.
   *
   * @param config the configuration.
   */
  public static void addDefaultConfigValues(final AggregateConfiguration config) {
    if (config.getOptional(SECTION, WORKER_THREADS) == null) {
      config.setValue(SECTION, WORKER_THREADS, Integer.toString(Runtime.getRuntime().availableProcessors()));
    }
    if (config.getOptional(SECTION, USE_TILE_METADATA) == null) {
      config.setValue(SECTION, USE_TILE_METADATA, Boolean.toString(DEFAULT_USE_TILE_METADATA));
    }
    if (config.getOptional(SECTION, STEP_TIMEOUT_SECONDS) == null) {
      config.setValue(SECTION, STEP_TIMEOUT_SECONDS, Long.toString(DEFAULT_STEP_TIMEOUT_SECONDS));
    }
  }
}

package edu.washington.escience.arrayagg.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import edu.washington.escience.arrayagg.AggregateCapacityException;
import edu.washington.escience.arrayagg.DbException;
import edu.washington.escience.arrayagg.RecomputeNotSupportedException;
import edu.washington.escience.arrayagg.operator.agg.Aggregator;
import edu.washington.escience.arrayagg.storage.TileMetadata;
import edu.washington.escience.arrayagg.util.concurrent.RenamingThreadFactory;

/**
 * One read step of an {@link AggregateQuery}: feeds a batch of tiles to every bound aggregator on a pool of worker
 * threads, then copies the results into the bound destinations.
 */
public final class AggregateReadStep {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(AggregateReadStep.class);

  /** The query this step belongs to. */
  private final AggregateQuery query;
  /** Output field name to aggregator. */
  private final ImmutableMap<String, Aggregator> aggregates;
  /** Number of worker threads. */
  private final int workerThreads;
  /** Whether full tiles may be aggregated from their statistics. */
  private final boolean useTileMetadata;
  /** How long to wait for the workers. */
  private final long timeoutSeconds;
  /** Set once the tiles were processed. */
  private boolean processed;

  /**
   * @param query the query this step belongs to.
   * @param aggregates output field name to aggregator.
   * @param workerThreads number of worker threads.
   * @param useTileMetadata whether full tiles may be aggregated from their statistics.
   * @param timeoutSeconds how long to wait for the workers.
   */
  AggregateReadStep(final AggregateQuery query, final ImmutableMap<String, Aggregator> aggregates,
      final int workerThreads, final boolean useTileMetadata, final long timeoutSeconds) {
    Preconditions.checkArgument(workerThreads > 0, "workerThreads must be positive");
    this.query = query;
    this.aggregates = aggregates;
    this.workerThreads = workerThreads;
    this.useTileMetadata = useTileMetadata;
    this.timeoutSeconds = timeoutSeconds;
  }

  /**
   * Feed the tiles to the aggregators. Returns once every tile has been consumed.
   *
   * @param tiles the tiles of this step.
   * @throws DbException if a worker fails or the workers time out. The query is failed.
   */
  public void process(final List<? extends ResultTile> tiles) throws DbException {
    Preconditions.checkState(!processed, "read step already processed");
    processed = true;
    query.setStatus(QueryStatus.IN_PROGRESS);
    ExecutorService pool = Executors.newFixedThreadPool(workerThreads, new RenamingThreadFactory("aggregate-step"));
    try {
      List<Future<?>> futures = new ArrayList<>(tiles.size());
      for (final ResultTile tile : tiles) {
        futures.add(pool.submit(() -> aggregateTile(tile)));
      }
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
      for (Future<?> future : futures) {
        future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      }
    } catch (ExecutionException e) {
      fail("a worker failed", e.getCause());
      throw new DbException("Aggregate read step failed", e.getCause());
    } catch (TimeoutException e) {
      fail("workers timed out", e);
      throw new DbException("Aggregate read step timed out after " + timeoutSeconds + " seconds", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fail("interrupted", e);
      throw new DbException("Aggregate read step interrupted", e);
    } finally {
      pool.shutdownNow();
    }
    LOGGER.info("Aggregated {} tiles into {} aggregates", tiles.size(), aggregates.size());
  }

  /**
   * @param tile a tile to feed to every aggregator.
   */
  private void aggregateTile(final ResultTile tile) {
    for (Aggregator aggregator : aggregates.values()) {
      String fieldName = aggregator.fieldName();
      TileMetadata metadata = useTileMetadata && tile.copyFullTile() ? tile.tileMetadata(fieldName) : null;
      if (metadata != null) {
        aggregator.aggregateTileWithFragMd(metadata);
      } else {
        aggregator.aggregateData(tile.aggregateBuffer(fieldName));
      }
    }
  }

  /**
   * Copy every result into its destination, in binding order.
   *
   * @throws RecomputeNotSupportedException if a result does not fit after an earlier result of this step was copied.
   * @throws DbException if the first result does not fit.
   */
  public void copyResults() throws DbException {
    Preconditions.checkState(processed, "read step was not processed");
    boolean copied = false;
    for (Map.Entry<String, Aggregator> binding : aggregates.entrySet()) {
      try {
        binding.getValue().copyToUserBuffer(binding.getKey(), query.getBuffers());
      } catch (AggregateCapacityException e) {
        if (copied) {
          fail("result did not fit after another result was copied", e);
          throw new RecomputeNotSupportedException(binding.getKey(), e);
        }
        throw e;
      }
      copied = true;
    }
    query.setStatus(QueryStatus.COMPLETED);
  }

  /**
   * @param reason why the step failed.
   * @param cause the failure.
   */
  private void fail(final String reason, final Throwable cause) {
    query.setStatus(QueryStatus.FAILED);
    LOGGER.warn("Aggregate read step failed: {}", reason, cause);
  }
}

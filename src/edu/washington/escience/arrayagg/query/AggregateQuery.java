package edu.washington.escience.arrayagg.query;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.DbException;
import edu.washington.escience.arrayagg.operator.agg.Aggregator;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.tool.AggregateConfiguration;
import edu.washington.escience.arrayagg.tool.ConfigFileException;

/**
 * A read query computing aggregates. Aggregates and destination buffers are bound while the query is
 * {@link QueryStatus#UNINITIALIZED}, validated by {@link #init()}, and then fed by one or more
 * {@link AggregateReadStep}s. Results accumulate across steps.
 */
public final class AggregateQuery {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(AggregateQuery.class);

  /** Reported by lifecycle errors. */
  static final String ORIGIN = "AggregateQuery";

  /** Engine settings. */
  private final AggregateConfiguration config;
  /** The only channel of the query. */
  private final QueryChannel defaultChannel;
  /** Output field name to destination. */
  private final Map<String, QueryBuffer> buffers = new LinkedHashMap<>();
  /** Where the query is in its lifecycle. */
  private volatile QueryStatus status = QueryStatus.UNINITIALIZED;

  /**
   * @param config engine settings.
   */
  public AggregateQuery(final AggregateConfiguration config) {
    this.config = Objects.requireNonNull(config, "config");
    defaultChannel = new QueryChannel(ArrayAggConstants.DEFAULT_CHANNEL_NAME, this);
  }

  /**
   * @return a query using the settings of the shipped configuration file.
   * @throws ConfigFileException if that file cannot be parsed.
   */
  public static AggregateQuery withDefaults() throws ConfigFileException {
    return new AggregateQuery(AggregateConfiguration.loadDefault());
  }

  /** @return the default channel. */
  public QueryChannel getDefaultChannel() {
    return defaultChannel;
  }

  /**
   * Bind an aggregator on the default channel.
   *
   * @param outputFieldName the output field name.
   * @param aggregator computes the output field.
   * @throws AggregateConfigurationException if the name is taken or the query was already initialized.
   */
  public void addAggregate(final String outputFieldName, final Aggregator aggregator)
      throws AggregateConfigurationException {
    defaultChannel.addAggregate(outputFieldName, aggregator);
  }

  /**
   * Bind the destination of an output field.
   *
   * @param outputFieldName the output field name.
   * @param buffer the destination.
   * @throws AggregateConfigurationException if the query was already initialized.
   */
  public synchronized void setBuffer(final String outputFieldName, final QueryBuffer buffer)
      throws AggregateConfigurationException {
    Objects.requireNonNull(outputFieldName, "outputFieldName");
    Objects.requireNonNull(buffer, "buffer");
    if (status != QueryStatus.UNINITIALIZED) {
      throw new AggregateConfigurationException(ORIGIN, "Cannot set buffer " + outputFieldName
          + " on a query that is already initialized.");
    }
    buffers.put(outputFieldName, buffer);
  }

  /**
   * Validate the destination of every bound aggregate.
   *
   * @throws DbException if a destination is missing or has the wrong shape.
   */
  public synchronized void init() throws DbException {
    Preconditions.checkState(status == QueryStatus.UNINITIALIZED, "query is already %s", status);
    for (Map.Entry<String, Aggregator> binding : defaultChannel.getAggregates().entrySet()) {
      binding.getValue().validateOutputBuffer(binding.getKey(), buffers);
    }
    status = QueryStatus.INITIALIZED;
    LOGGER.debug("Initialized aggregate query with {}", defaultChannel);
  }

  /**
   * @return a step feeding tiles to the aggregators of this query.
   * @throws DbException if the configuration cannot be read.
   */
  public AggregateReadStep newReadStep() throws DbException {
    QueryStatus current = status;
    Preconditions.checkState(current != QueryStatus.UNINITIALIZED && current != QueryStatus.FAILED,
        "cannot read from a query that is %s", current);
    return new AggregateReadStep(this, defaultChannel.getAggregates(), config.getWorkerThreads(),
        config.useTileMetadata(), config.getStepTimeoutSeconds());
  }

  /** @return where the query is in its lifecycle. */
  public QueryStatus getStatus() {
    return status;
  }

  /**
   * @param newStatus the new lifecycle state.
   */
  void setStatus(final QueryStatus newStatus) {
    status = newStatus;
  }

  /** @return the destinations. */
  synchronized Map<String, QueryBuffer> getBuffers() {
    return buffers;
  }
}

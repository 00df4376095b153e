package edu.washington.escience.arrayagg.query;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.operator.agg.Aggregator;

/**
 * A named set of output field to aggregator bindings evaluated together by one query. Bindings keep the order they were
 * added in.
 */
public final class QueryChannel {
  /** Reported by registration errors. */
  static final String ORIGIN = "QueryChannel";

  /** The channel name. */
  private final String name;
  /** The query owning this channel. */
  private final AggregateQuery query;
  /** Output field name to aggregator. */
  private final Map<String, Aggregator> aggregates = new LinkedHashMap<>();

  /**
   * @param name the channel name.
   * @param query the query owning this channel.
   */
  QueryChannel(final String name, final AggregateQuery query) {
    this.name = Objects.requireNonNull(name, "name");
    this.query = Objects.requireNonNull(query, "query");
  }

  /** @return the channel name. */
  public String getName() {
    return name;
  }

  /**
   * Bind an aggregator to an output field.
   *
   * @param outputFieldName the output field name.
   * @param aggregator computes the output field.
   * @throws AggregateConfigurationException if the name is taken or the query was already initialized.
   */
  public synchronized void addAggregate(final String outputFieldName, final Aggregator aggregator)
      throws AggregateConfigurationException {
    Objects.requireNonNull(outputFieldName, "outputFieldName");
    Objects.requireNonNull(aggregator, "aggregator");
    if (query.getStatus() != QueryStatus.UNINITIALIZED) {
      throw new AggregateConfigurationException(ORIGIN,
          "Cannot add aggregate " + outputFieldName + " to a query that is already initialized.");
    }
    if (aggregates.containsKey(outputFieldName)) {
      throw new AggregateConfigurationException(ORIGIN,
          "Output field " + outputFieldName + " is already bound on channel " + name + ".");
    }
    aggregates.put(outputFieldName, aggregator);
  }

  /**
   * @param outputFieldName an output field name.
   * @return its aggregator, null if the name is not bound.
   */
  @Nullable
  public synchronized Aggregator getAggregate(final String outputFieldName) {
    return aggregates.get(outputFieldName);
  }

  /** @return the bindings, in the order they were added. */
  public synchronized ImmutableMap<String, Aggregator> getAggregates() {
    return ImmutableMap.copyOf(aggregates);
  }

  /** @return true if nothing is bound. An empty channel is left out of encodings. */
  public synchronized boolean isEmpty() {
    return aggregates.isEmpty();
  }

  @Override
  public synchronized String toString() {
    return "QueryChannel[" + name + ", " + aggregates.keySet() + "]";
  }
}

package edu.washington.escience.arrayagg.api.encoding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.DbException;
import edu.washington.escience.arrayagg.api.ArrayAggJsonMapperProvider;
import edu.washington.escience.arrayagg.operator.agg.Aggregator;
import edu.washington.escience.arrayagg.query.AggregateQuery;
import edu.washington.escience.arrayagg.query.QueryChannel;

/**
 * Converts the aggregates of a query to and from JSON.
 */
public final class AggregateEncodings {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(AggregateEncodings.class);

  /** Utility class. */
  private AggregateEncodings() {}

  /**
   * @param query a query.
   * @return the encoding of its aggregates.
   */
  public static QueryAggregatesEncoding encode(final AggregateQuery query) {
    QueryAggregatesEncoding encoding = new QueryAggregatesEncoding();
    encoding.channels = new ArrayList<>();
    QueryChannel channel = query.getDefaultChannel();
    if (!channel.isEmpty()) {
      ChannelEncoding channelEncoding = new ChannelEncoding();
      channelEncoding.name = channel.getName();
      channelEncoding.aggregates = new ArrayList<>();
      for (Map.Entry<String, Aggregator> binding : channel.getAggregates().entrySet()) {
        channelEncoding.aggregates.add(AggregateEncoding.of(binding.getValue(), binding.getKey()));
      }
      encoding.channels.add(channelEncoding);
    }
    return encoding;
  }

  /**
   * @param query a query.
   * @return the JSON encoding of its aggregates.
   * @throws DbException if the encoding cannot be written.
   */
  public static String toJson(final AggregateQuery query) throws DbException {
    try {
      return ArrayAggJsonMapperProvider.getWriter().writeValueAsString(encode(query));
    } catch (JsonProcessingException e) {
      throw new DbException("Cannot encode the aggregates of the query", e);
    }
  }

  /**
   * @param json the JSON encoding of some aggregates.
   * @return the decoded and validated encoding.
   * @throws DbException if the JSON cannot be read or is invalid.
   */
  public static QueryAggregatesEncoding fromJson(final String json) throws DbException {
    QueryAggregatesEncoding encoding;
    try {
      encoding = ArrayAggJsonMapperProvider.getMapper().readValue(json, QueryAggregatesEncoding.class);
    } catch (IOException e) {
      throw new DbException("Cannot decode aggregates", e);
    }
    encoding.validate();
    for (ChannelEncoding channel : encoding.channels) {
      channel.validate();
      for (AggregateEncoding aggregate : channel.aggregates) {
        aggregate.validate();
      }
    }
    return encoding;
  }

  /**
   * Build the aggregates of an encoding and bind them on a query.
   *
   * @param json the JSON encoding of some aggregates.
   * @param query an uninitialized query.
   * @throws DbException if the JSON is invalid or an aggregate cannot be bound.
   */
  public static void applyTo(final String json, final AggregateQuery query) throws DbException {
    QueryAggregatesEncoding encoding = fromJson(json);
    List<ChannelEncoding> channels = encoding.channels;
    for (ChannelEncoding channel : channels) {
      if (!ArrayAggConstants.DEFAULT_CHANNEL_NAME.equals(channel.name)) {
        throw new AggregateConfigurationException(AggregateEncodings.class.getSimpleName(),
            "Unknown channel " + channel.name + ".");
      }
      for (AggregateEncoding aggregate : channel.aggregates) {
        query.addAggregate(aggregate.outputFieldName, aggregate.construct());
      }
    }
    LOGGER.debug("Bound {} channels from JSON", channels.size());
  }
}

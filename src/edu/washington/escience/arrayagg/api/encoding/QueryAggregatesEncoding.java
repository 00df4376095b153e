package edu.washington.escience.arrayagg.api.encoding;

import java.util.List;

/** JSON wrapper for the aggregates of a query. Channels without aggregates are left out. */
public class QueryAggregatesEncoding extends ArrayAggEncoding {
  /** The non-empty channels. */
  @Required public List<ChannelEncoding> channels;
}

package edu.washington.escience.arrayagg.api.encoding;

import java.util.List;

/** JSON wrapper for a query channel. */
public class ChannelEncoding extends ArrayAggEncoding {
  /** The channel name. */
  @Required public String name;
  /** The aggregates bound on the channel, in binding order. */
  @Required public List<AggregateEncoding> aggregates;
}

package edu.washington.escience.arrayagg.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.DbException;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.operator.agg.Aggregator;
import edu.washington.escience.arrayagg.operator.agg.CountAggregator;
import edu.washington.escience.arrayagg.operator.agg.SumAggregator;
import edu.washington.escience.arrayagg.storage.QueryBuffer;

public class QueryChannelTest {

  @Test
  public void testBindingsKeepOrder() throws DbException {
    QueryChannel channel = AggregateQuery.withDefaults().getDefaultChannel();
    assertEquals(ArrayAggConstants.DEFAULT_CHANNEL_NAME, channel.getName());
    assertTrue(channel.isEmpty());
    Aggregator sum = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.INT32));
    channel.addAggregate("Sum", sum);
    channel.addAggregate("Count", new CountAggregator());
    channel.addAggregate("Another", new CountAggregator());
    assertFalse(channel.isEmpty());
    assertSame(sum, channel.getAggregate("Sum"));
    assertNull(channel.getAggregate("Nothing"));
    assertEquals(ImmutableList.of("Sum", "Count", "Another"), channel.getAggregates().keySet().asList());
  }

  @Test
  public void testDuplicateName() throws DbException {
    QueryChannel channel = AggregateQuery.withDefaults().getDefaultChannel();
    Aggregator first = new CountAggregator();
    channel.addAggregate("Count", first);
    try {
      channel.addAggregate("Count", new CountAggregator());
      fail();
    } catch (AggregateConfigurationException e) {
      assertTrue(e.getMessage().startsWith("QueryChannel: "));
    }
    assertSame(first, channel.getAggregate("Count"));
  }

  @Test
  public void testNoRegistrationAfterInit() throws DbException {
    AggregateQuery query = AggregateQuery.withDefaults();
    query.addAggregate("Count", new CountAggregator());
    query.setBuffer("Count", QueryBuffer.fixed(8));
    query.init();
    try {
      query.getDefaultChannel().addAggregate("Count2", new CountAggregator());
      fail();
    } catch (AggregateConfigurationException e) {
      assertTrue(e.getMessage().contains("already initialized"));
    }
    assertEquals(1, query.getDefaultChannel().getAggregates().size());
  }
}

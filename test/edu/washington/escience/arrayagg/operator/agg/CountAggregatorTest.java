package edu.washington.escience.arrayagg.operator.agg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.DbException;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.InvalidOutputBufferException;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;
import edu.washington.escience.arrayagg.util.TestUtils;

public class CountAggregatorTest {

  @Test
  public void testCount() throws DbException {
    for (Datatype type : SumAggregatorTest.NUMERIC_TYPES) {
      new AggregationScenario(type, field -> new CountAggregator(), true, false).run()
          .assertResults(8, 18, 28, 8, 18, 28, 3, 5, 2, 5, 10, 13, 10, 13);
    }
  }

  @Test
  public void testNullCount() throws DbException {
    for (Datatype type : SumAggregatorTest.NUMERIC_TYPES) {
      new AggregationScenario(type, NullCountAggregator::new, false, false).run()
          .assertResults(0, 0, 0, 4, 14, 19, 0, 0, 2, 3, 0, 0, 3, 6);
    }
  }

  @Test
  public void testCountProperties() {
    CountAggregator aggregator = new CountAggregator();
    assertEquals(ArrayAggConstants.COUNT_OF_ROWS, aggregator.fieldName());
    assertNull(aggregator.fieldInfo());
    assertEquals(AggregationOp.COUNT, aggregator.aggregationOp());
    assertEquals(Datatype.UINT64, aggregator.outputDatatype());
    assertFalse(aggregator.aggregationVarSized());
    assertFalse(aggregator.aggregationNullable());
    assertTrue(aggregator.needRecomputeOnOverflow());
  }

  @Test
  public void testNullCountProperties() throws DbException {
    NullCountAggregator aggregator = new NullCountAggregator(FieldInfo.fixed("a1", true, Datatype.STRING_ASCII));
    assertEquals("a1", aggregator.fieldName());
    assertEquals(AggregationOp.NULL_COUNT, aggregator.aggregationOp());
    assertFalse(aggregator.aggregationNullable());
  }

  @Test
  public void testNullCountRequiresNullableField() throws DbException {
    try {
      new NullCountAggregator(FieldInfo.fixed("a1", false, Datatype.INT32));
      fail();
    } catch (AggregateConfigurationException e) {
      assertTrue(e.getMessage().endsWith("Aggregate must only be requested for nullable fields."));
    }
  }

  @Test
  public void testMetadataCounts() throws DbException {
    CountAggregator count = new CountAggregator();
    NullCountAggregator nullCount = new NullCountAggregator(FieldInfo.fixed("a1", true, Datatype.INT32));
    TileMetadata md = TileMetadata.withLongSum(100, 30, new byte[4], new byte[4], 0);
    count.aggregateTileWithFragMd(md);
    nullCount.aggregateTileWithFragMd(md);
    assertEquals(100, count.getCount());
    assertEquals(30, nullCount.getCount());
  }

  @Test
  public void testCopyWritesUint64() throws DbException {
    CountAggregator aggregator = new CountAggregator();
    aggregator.aggregateTileWithFragMd(TileMetadata.withLongSum(7, 0, null, null, 0));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Count", QueryBuffer.fixed(8));
    aggregator.copyToUserBuffer("Count", buffers);
    assertEquals(7, TestUtils.readLong(buffers.get("Count")));
    assertEquals(8, buffers.get("Count").bufferSize());
  }

  /**
   * @param aggregator the aggregator.
   * @param buffers the bound buffers.
   * @param message expected message suffix.
   */
  private static void assertRejected(final Aggregator aggregator, final Map<String, QueryBuffer> buffers,
      final String message) {
    try {
      aggregator.validateOutputBuffer("Count", buffers);
      fail("expected " + message);
    } catch (InvalidOutputBufferException e) {
      assertTrue(e.getMessage(), e.getMessage().endsWith(message));
    } catch (DbException e) {
      throw new AssertionError(e);
    }
  }

  @Test
  public void testValidateOutputBuffer() throws DbException {
    CountAggregator aggregator = new CountAggregator();
    Map<String, QueryBuffer> buffers = new HashMap<>();
    assertRejected(aggregator, buffers, "Result buffer doesn't exist.");

    buffers.put("Count", QueryBuffer.fixed(4));
    assertRejected(aggregator, buffers, "Aggregate fixed size buffer should be for one element only.");

    buffers.put("Count", new QueryBuffer(ByteBuffer.allocate(8), ByteBuffer.allocate(8), null));
    assertRejected(aggregator, buffers, "Aggregate must not have a var buffer.");

    buffers.put("Count", QueryBuffer.fixedNullable(8));
    assertRejected(aggregator, buffers, "Count aggregates must not have a validity buffer.");

    buffers.put("Count", QueryBuffer.fixed(8));
    aggregator.validateOutputBuffer("Count", buffers);
  }
}

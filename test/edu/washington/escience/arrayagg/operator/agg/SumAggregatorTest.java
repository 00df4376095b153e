package edu.washington.escience.arrayagg.operator.agg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.UnsignedLong;

import edu.washington.escience.arrayagg.AggregateConfigurationException;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.DbException;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.util.TestUtils;

public class SumAggregatorTest {

  /** Every numeric input type. */
  static final List<Datatype> NUMERIC_TYPES = ImmutableList.of(Datatype.UINT8, Datatype.UINT16, Datatype.UINT32,
      Datatype.UINT64, Datatype.INT8, Datatype.INT16, Datatype.INT32, Datatype.INT64, Datatype.FLOAT32,
      Datatype.FLOAT64);

  @Test
  public void testBasicAggregation() throws DbException {
    for (Datatype type : NUMERIC_TYPES) {
      new AggregationScenario(type, SumAggregator::new, true, true).run()
          .assertResults(27, 27, 37, 14, 14, 24, 11, 14, 0, 6, 29, 34, 22, 22);
    }
  }

  @Test
  public void testBasicAggregationValidity() throws DbException {
    new AggregationScenario(Datatype.INT32, SumAggregator::new, true, true).run()
        .assertValidity(-1, -1, -1, 1, 1, 1, -1, -1, 0, 1, -1, -1, 1, 1);
  }

  @Test
  public void testOutputDatatype() throws DbException {
    assertEquals(Datatype.INT64, new SumAggregator(FieldInfo.fixed("a1", false, Datatype.INT8)).outputDatatype());
    assertEquals(Datatype.INT64, new SumAggregator(FieldInfo.fixed("a1", false, Datatype.INT64)).outputDatatype());
    assertEquals(Datatype.UINT64, new SumAggregator(FieldInfo.fixed("a1", false, Datatype.UINT16)).outputDatatype());
    assertEquals(Datatype.FLOAT64, new SumAggregator(FieldInfo.fixed("a1", false, Datatype.FLOAT32)).outputDatatype());
  }

  @Test
  public void testFlags() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", true, Datatype.UINT8));
    assertEquals("a1", aggregator.fieldName());
    assertFalse(aggregator.aggregationVarSized());
    assertTrue(aggregator.aggregationNullable());
    assertTrue(aggregator.needRecomputeOnOverflow());
  }

  @Test(expected = AggregateConfigurationException.class)
  public void testRejectsStrings() throws DbException {
    new SumAggregator(FieldInfo.var("a1", false, Datatype.STRING_ASCII));
  }

  @Test(expected = AggregateConfigurationException.class)
  public void testRejectsMultiValueCells() throws DbException {
    new SumAggregator(new FieldInfo("a1", false, false, 2, Datatype.INT32));
  }

  /**
   * @param aggregator the aggregator.
   * @param data the cells.
   * @param buffers the destination.
   * @return the result.
   * @throws DbException if the copy fails.
   */
  private static long aggregateAndRead(final SumAggregator aggregator, final AggregateBuffer.Builder data,
      final Map<String, QueryBuffer> buffers) throws DbException {
    aggregator.aggregateData(data.build());
    aggregator.copyToUserBuffer("Agg", buffers);
    return TestUtils.readLong(buffers.get("Agg"));
  }

  /**
   * @param min first cell.
   * @param max one past the last cell.
   * @return a window over the signed overflow test values.
   */
  private static AggregateBuffer.Builder signedWindow(final int min, final int max) {
    return AggregateBuffer.builder(min, max, 4,
        TestUtils.encode(Datatype.INT64, 1, Long.MAX_VALUE - 2, -1, Long.MIN_VALUE + 2));
  }

  @Test
  public void testSignedOverflow() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.INT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));

    assertEquals(Long.MAX_VALUE - 1, aggregateAndRead(aggregator, signedWindow(0, 2), buffers));
    /* Reached max but still hasn't overflowed. */
    assertEquals(Long.MAX_VALUE, aggregateAndRead(aggregator, signedWindow(0, 1), buffers));
    /* We can still subtract. */
    assertEquals(Long.MAX_VALUE - 1, aggregateAndRead(aggregator, signedWindow(2, 3), buffers));
    aggregator.aggregateData(signedWindow(0, 1).build());
    assertFalse(aggregator.isOverflowed());
    assertEquals(Long.MAX_VALUE, aggregateAndRead(aggregator, signedWindow(0, 1), buffers));
    assertTrue(aggregator.isOverflowed());
    /* Once overflowed, the value doesn't change. */
    assertEquals(Long.MAX_VALUE, aggregateAndRead(aggregator, signedWindow(2, 3), buffers));
  }

  @Test
  public void testSignedUnderflow() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.INT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));

    assertEquals(Long.MIN_VALUE + 1, aggregateAndRead(aggregator, signedWindow(2, 4), buffers));
    assertEquals(Long.MIN_VALUE, aggregateAndRead(aggregator, signedWindow(2, 3), buffers));
    assertEquals(Long.MIN_VALUE + 1, aggregateAndRead(aggregator, signedWindow(0, 1), buffers));
    aggregator.aggregateData(signedWindow(2, 3).build());
    /* Underflow pins to the maximum too. */
    assertEquals(Long.MAX_VALUE, aggregateAndRead(aggregator, signedWindow(2, 3), buffers));
    assertEquals(Long.MAX_VALUE, aggregateAndRead(aggregator, signedWindow(0, 1), buffers));
  }

  @Test
  public void testUnsignedOverflow() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.UINT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));
    long max = UnsignedLong.MAX_VALUE.longValue();
    AggregateBuffer.Builder both = AggregateBuffer.builder(0, 2, 2, TestUtils.uint64s(1, max - 2));
    AggregateBuffer.Builder one = AggregateBuffer.builder(0, 1, 2, TestUtils.uint64s(1, max - 2));

    assertEquals(max - 1, aggregateAndRead(aggregator, both, buffers));
    assertEquals(max, aggregateAndRead(aggregator, one, buffers));
    aggregator.aggregateData(one.build());
    assertEquals(max, aggregateAndRead(aggregator, one, buffers));
    assertTrue(aggregator.isOverflowed());
  }

  @Test
  public void testWeightedValueOverflow() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.INT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));
    AggregateBuffer.Builder data =
        AggregateBuffer.builder(0, 1, 1, TestUtils.encode(Datatype.INT64, Long.MAX_VALUE / 2 + 1)).countBitmap(
            TestUtils.uint64s(2));
    assertEquals(Long.MAX_VALUE, aggregateAndRead(aggregator, data, buffers));
    assertTrue(aggregator.isOverflowed());
  }

  @Test
  public void testDoubleOverflow() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.FLOAT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));
    AggregateBuffer max = AggregateBuffer.builder(0, 1, 2,
        TestUtils.encodeDoubles(Datatype.FLOAT64, Double.MAX_VALUE, -Double.MAX_VALUE)).build();
    AggregateBuffer lowest = AggregateBuffer.builder(1, 2, 2,
        TestUtils.encodeDoubles(Datatype.FLOAT64, Double.MAX_VALUE, -Double.MAX_VALUE)).build();

    aggregator.aggregateData(max);
    aggregator.copyToUserBuffer("Agg", buffers);
    assertEquals(Double.MAX_VALUE, TestUtils.readDouble(buffers.get("Agg")), 0);
    aggregator.aggregateData(max);
    aggregator.copyToUserBuffer("Agg", buffers);
    assertEquals(Double.MAX_VALUE, TestUtils.readDouble(buffers.get("Agg")), 0);
    aggregator.aggregateData(lowest);
    aggregator.copyToUserBuffer("Agg", buffers);
    assertEquals(Double.MAX_VALUE, TestUtils.readDouble(buffers.get("Agg")), 0);
  }

  @Test
  public void testDoubleUnderflow() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.FLOAT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));
    AggregateBuffer lowest = AggregateBuffer.builder(1, 2, 2,
        TestUtils.encodeDoubles(Datatype.FLOAT64, Double.MAX_VALUE, -Double.MAX_VALUE)).build();

    aggregator.aggregateData(lowest);
    aggregator.copyToUserBuffer("Agg", buffers);
    assertEquals(-Double.MAX_VALUE, TestUtils.readDouble(buffers.get("Agg")), 0);
    aggregator.aggregateData(lowest);
    aggregator.copyToUserBuffer("Agg", buffers);
    assertEquals(Double.MAX_VALUE, TestUtils.readDouble(buffers.get("Agg")), 0);
  }

  @Test
  public void testNaNIsNotOverflow() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.FLOAT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));
    aggregator.aggregateData(AggregateBuffer.builder(0, 3, 3,
        TestUtils.encodeDoubles(Datatype.FLOAT64, 1.0, Double.NaN, 2.0)).build());
    aggregator.aggregateData(AggregateBuffer.builder(0, 1, 1, TestUtils.encodeDoubles(Datatype.FLOAT64, 5.0)).build());
    aggregator.copyToUserBuffer("Agg", buffers);
    assertTrue(Double.isNaN(TestUtils.readDouble(buffers.get("Agg"))));
    assertFalse(aggregator.isOverflowed());
    assertEquals(4, aggregator.getCount());
  }

  @Test
  public void testNullableOverflowIsValid() throws DbException {
    SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", true, Datatype.INT64));
    Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixedNullable(8));
    AggregateBuffer.Builder data =
        AggregateBuffer.builder(0, 2, 2, TestUtils.encode(Datatype.INT64, Long.MAX_VALUE, 1)).validity(
            TestUtils.bytes(1, 1));
    assertEquals(Long.MAX_VALUE, aggregateAndRead(aggregator, data, buffers));
    assertTrue(aggregator.isOverflowed());
    assertEquals(1, TestUtils.readValidity(buffers.get("Agg")));
  }

  @Test
  public void testOrderDoesNotMatter() throws DbException {
    Random random = new Random(42);
    long[] values = new long[100];
    for (int i = 0; i < values.length; ++i) {
      values[i] = random.nextInt(2000) - 1000;
    }
    List<AggregateBuffer> windows = new ArrayList<>();
    for (int start = 0; start < values.length; start += 7) {
      windows.add(AggregateBuffer.builder(start, Math.min(start + 7, values.length), values.length,
          TestUtils.encode(Datatype.INT32, values)).build());
    }
    Long expected = null;
    for (int round = 0; round < 5; ++round) {
      Collections.shuffle(windows, random);
      SumAggregator aggregator = new SumAggregator(FieldInfo.fixed("a1", false, Datatype.INT32));
      for (AggregateBuffer window : windows) {
        aggregator.aggregateData(window);
      }
      Map<String, QueryBuffer> buffers = ImmutableMap.of("Agg", QueryBuffer.fixed(8));
      aggregator.copyToUserBuffer("Agg", buffers);
      long sum = TestUtils.readLong(buffers.get("Agg"));
      if (expected == null) {
        expected = sum;
      }
      assertEquals(expected.longValue(), sum);
      assertEquals(values.length, aggregator.getCount());
    }
  }
}

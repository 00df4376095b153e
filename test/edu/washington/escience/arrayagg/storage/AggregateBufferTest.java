package edu.washington.escience.arrayagg.storage;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.util.TestUtils;

public class AggregateBufferTest {

  @Test
  public void testVarCells() {
    AggregateBuffer buffer = AggregateBuffer.builder(0, 10, 10, TestUtils.uint64s(TestUtils.OFFSETS)).varData(
        TestUtils.ascii(TestUtils.VAR_DATA), TestUtils.VAR_DATA.length()).build();
    assertEquals(11, buffer.varOffset(5));
    assertEquals(15, buffer.varEnd(5));
    /* The last cell ends at the size of the var data. */
    assertEquals(23, buffer.varEnd(9));
    assertArrayEquals("5555".getBytes(StandardCharsets.US_ASCII), buffer.varValue(5));
    assertArrayEquals("1".getBytes(StandardCharsets.US_ASCII), buffer.varValue(9));
  }

  @Test
  public void testWeights() {
    ByteBuffer data = TestUtils.encode(Datatype.INT32, TestUtils.FIXED_DATA);
    assertEquals(1, AggregateBuffer.builder(0, 10, 10, data).build().weight(3));
    AggregateBuffer bool = AggregateBuffer.builder(0, 10, 10, data).booleanBitmap(TestUtils.bytes(TestUtils.BITMAP))
        .build();
    assertFalse(bool.isCountBitmap());
    assertEquals(0, bool.weight(2));
    assertEquals(1, bool.weight(5));
    AggregateBuffer counted = AggregateBuffer.builder(0, 10, 10, data).countBitmap(
        TestUtils.uint64s(TestUtils.COUNT_BITMAP)).build();
    assertTrue(counted.isCountBitmap());
    assertEquals(4, counted.weight(2));
  }

  @Test
  public void testValidity() {
    ByteBuffer data = TestUtils.encode(Datatype.INT32, TestUtils.FIXED_DATA);
    assertTrue(AggregateBuffer.builder(0, 10, 10, data).build().isValid(0));
    AggregateBuffer nullable = AggregateBuffer.builder(0, 10, 10, data).validity(TestUtils.bytes(TestUtils.VALIDITY))
        .build();
    assertFalse(nullable.isValid(0));
    assertTrue(nullable.isValid(2));
  }

  @Test
  public void testReadsLittleEndianWhateverTheCallerOrder() {
    ByteBuffer big = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
    big.order(ByteOrder.LITTLE_ENDIAN).putLong(0, 42).order(ByteOrder.BIG_ENDIAN);
    AggregateBuffer buffer = AggregateBuffer.builder(0, 1, 1, big).build();
    assertEquals(42, Datatype.INT64.getLong(buffer.fixedData(), 0));
  }

  @Test
  public void testFixedValue() {
    AggregateBuffer buffer = AggregateBuffer.builder(0, 3, 3, TestUtils.ascii("aabbcc")).build();
    assertArrayEquals("bb".getBytes(StandardCharsets.US_ASCII), buffer.fixedValue(1, 2));
  }

  @Test(expected = IllegalStateException.class)
  public void testVarValueWithoutVarData() {
    AggregateBuffer.builder(0, 1, 1, TestUtils.uint64s(0)).build().varValue(0);
  }

  @Test
  public void testTileMetadata() {
    TileMetadata md = TileMetadata.withDoubleSum(10, 4, TestUtils.bytes(1, 0, 0, 0).array(),
        TestUtils.bytes(9, 0, 0, 0).array(), 2.5);
    assertEquals(6, md.nonNullCount());
    assertEquals(2.5, md.sumAsDouble(), 0);
    assertEquals(9, md.max().getInt(0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTileMetadataNullCountOutOfRange() {
    TileMetadata.withLongSum(3, 4, null, null, 0);
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.InvalidOutputBufferException;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;

/**
 * Counts selected cells. The counter is a single {@link AtomicLong}, so concurrent calls need no other coordination.
 */
@ThreadSafe
public abstract class CountAggregatorBase implements Aggregator {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(CountAggregatorBase.class);

  /** Which cells are counted. */
  private final ValidityPolicy policy;

  /** The running count. */
  private final AtomicLong count = new AtomicLong();

  /**
   * @param policy which cells are counted.
   */
  protected CountAggregatorBase(final ValidityPolicy policy) {
    this.policy = policy;
  }

  @Override
  public boolean aggregationVarSized() {
    return false;
  }

  @Override
  public boolean aggregationNullable() {
    return false;
  }

  @Override
  public boolean needRecomputeOnOverflow() {
    return true;
  }

  @Override
  public Datatype outputDatatype() {
    return Datatype.UINT64;
  }

  @Override
  public void validateOutputBuffer(final String outputName, final Map<String, QueryBuffer> buffers)
      throws InvalidOutputBufferException {
    QueryBuffer buffer = OutputBufferValidator.ensureBufferExists(outputName, buffers);
    OutputBufferValidator.ensureFixedBuffer(buffer, ArrayAggConstants.AGGREGATE_RESULT_SIZE);
    OutputBufferValidator.ensureNoValidityForCount(buffer);
  }

  @Override
  public void aggregateData(final AggregateBuffer input) {
    long cells = AggregateKernel.countCells(input, policy);
    long total = count.addAndGet(cells);
    LOGGER.trace("{} counted {} cells in [{}, {}), total {}", fieldName(), cells, input.minCell(), input.maxCell(),
        total);
  }

  @Override
  public void aggregateTileWithFragMd(final TileMetadata tileMetadata) {
    count.addAndGet(policy == ValidityPolicy.NULL ? tileMetadata.nullCount() : tileMetadata.count());
  }

  @Override
  public void copyToUserBuffer(final String outputName, final Map<String, QueryBuffer> buffers) {
    QueryBuffer buffer = buffers.get(outputName);
    Datatype.UINT64.putLong(buffer.buffer(), count.get());
    buffer.setBufferSize(ArrayAggConstants.AGGREGATE_RESULT_SIZE);
  }

  /** @return the running count. */
  public long getCount() {
    return count.get();
  }
}

package edu.washington.escience.arrayagg.operator.agg;

import java.io.Serializable;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import edu.washington.escience.arrayagg.Datatype;
import edu.washington.escience.arrayagg.DbException;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;

/**
 * The interface for any aggregator. One instance computes one output field of a query. It is fed many
 * {@link AggregateBuffer}s, possibly from several threads at once, and is read out with
 * {@link #copyToUserBuffer(String, Map)} once the feeding threads are done.
 */
public interface Aggregator extends Serializable {

  /**
   * @return the aggregate computed.
   */
  AggregationOp aggregationOp();

  /**
   * @return the aggregated input field, null for COUNT.
   */
  @Nullable
  FieldInfo fieldInfo();

  /**
   * @return the name of the aggregated input field.
   */
  String fieldName();

  /**
   * @return true if the result is a variable-length value.
   */
  boolean aggregationVarSized();

  /**
   * @return true if the result carries a validity byte.
   */
  boolean aggregationNullable();

  /**
   * @return true if a result that does not fit its destination requires aggregating the data again.
   */
  boolean needRecomputeOnOverflow();

  /**
   * @return the datatype of the result.
   */
  Datatype outputDatatype();

  /**
   * Check that the destination bound for this aggregate has the shape of the result.
   *
   * @param outputName the output field name.
   * @param buffers the destinations bound by the user.
   * @throws DbException if the destination is missing or has the wrong shape.
   */
  void validateOutputBuffer(@Nonnull String outputName, @Nonnull Map<String, QueryBuffer> buffers)
      throws DbException;

  /**
   * Fold the selected cells of one buffer into the aggregate state. Thread safe.
   *
   * @param input the cells.
   */
  void aggregateData(@Nonnull AggregateBuffer input);

  /**
   * Fold a whole tile into the aggregate state using its precomputed statistics. Thread safe.
   *
   * @param tileMetadata the statistics of a tile whose cells are all selected.
   */
  void aggregateTileWithFragMd(@Nonnull TileMetadata tileMetadata);

  /**
   * Write the result into the destination. Must not run concurrently with the aggregation calls.
   *
   * @param outputName the output field name.
   * @param buffers the destinations bound by the user.
   * @throws DbException if the result does not fit the destination.
   */
  void copyToUserBuffer(@Nonnull String outputName, @Nonnull Map<String, QueryBuffer> buffers) throws DbException;
}

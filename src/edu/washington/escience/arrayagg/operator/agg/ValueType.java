package edu.washington.escience.arrayagg.operator.agg;

import java.io.Serializable;
import java.nio.ByteBuffer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import edu.washington.escience.arrayagg.AggregateCapacityException;
import edu.washington.escience.arrayagg.FieldInfo;
import edu.washington.escience.arrayagg.ValueKind;
import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.QueryBuffer;

/**
 * How MIN and MAX read, order and write the values of one {@link ValueKind}.
 *
 * @param <T> the Java type holding one value.
 */
public interface ValueType<T> extends Serializable {

  /** @return the kind of values handled. */
  ValueKind getValueKind();

  /**
   * @param input the cells.
   * @param cell a cell of the tile.
   * @param field the aggregated field.
   * @return the value of the cell.
   */
  @Nonnull
  T valueAt(AggregateBuffer input, int cell, FieldInfo field);

  /**
   * @param bytes an encoded value from tile metadata.
   * @param field the aggregated field.
   * @return the value.
   */
  @Nonnull
  T fromMetadata(ByteBuffer bytes, FieldInfo field);

  /**
   * @param left a value.
   * @param right a value.
   * @return negative, zero or positive as left orders before, with or after right.
   */
  int compare(T left, T right);

  /**
   * @param field the aggregated field.
   * @return the size in bytes of a fixed result.
   */
  long fixedResultSize(FieldInfo field);

  /**
   * Write a result into its destination and record the written sizes.
   *
   * @param value the result, null if no cell was aggregated.
   * @param field the aggregated field.
   * @param dest the destination.
   * @throws AggregateCapacityException if the value does not fit the destination.
   */
  void write(@Nullable T value, FieldInfo field, QueryBuffer dest) throws AggregateCapacityException;
}

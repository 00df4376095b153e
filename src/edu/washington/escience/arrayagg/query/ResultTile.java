package edu.washington.escience.arrayagg.query;

import javax.annotation.Nullable;

import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;

/**
 * A tile produced by the reader for one read step: the decoded cells of each field plus, where the storage layer kept
 * them, the tile statistics.
 */
public interface ResultTile {

  /**
   * @return true if every cell of the tile is selected, so the statistics describe exactly the selected cells.
   */
  boolean copyFullTile();

  /**
   * @param fieldName a field name, or the count of rows name for COUNT.
   * @return the statistics of the field in this tile, null if none were kept.
   */
  @Nullable
  TileMetadata tileMetadata(String fieldName);

  /**
   * @param fieldName a field name, or the count of rows name for COUNT.
   * @return the selected cells of the field.
   */
  AggregateBuffer aggregateBuffer(String fieldName);
}

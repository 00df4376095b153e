package edu.washington.escience.arrayagg.query;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import edu.washington.escience.arrayagg.storage.AggregateBuffer;
import edu.washington.escience.arrayagg.storage.TileMetadata;

/**
 * A {@link ResultTile} whose buffers are already decoded in memory.
 */
public final class MaterializedResultTile implements ResultTile {
  /** Whether every cell of the tile is selected. */
  private final boolean fullTile;
  /** Field name to cells. */
  private final ImmutableMap<String, AggregateBuffer> buffers;
  /** Field name to statistics. */
  private final ImmutableMap<String, TileMetadata> metadata;

  /**
   * @param fullTile whether every cell of the tile is selected.
   * @param buffers field name to cells.
   * @param metadata field name to statistics.
   */
  public MaterializedResultTile(final boolean fullTile, final Map<String, AggregateBuffer> buffers,
      final Map<String, TileMetadata> metadata) {
    this.fullTile = fullTile;
    this.buffers = ImmutableMap.copyOf(buffers);
    this.metadata = ImmutableMap.copyOf(metadata);
  }

  @Override
  public boolean copyFullTile() {
    return fullTile;
  }

  @Override
  @Nullable
  public TileMetadata tileMetadata(final String fieldName) {
    return metadata.get(fieldName);
  }

  @Override
  public AggregateBuffer aggregateBuffer(final String fieldName) {
    AggregateBuffer buffer = buffers.get(fieldName);
    Preconditions.checkArgument(buffer != null, "tile has no cells for field %s", fieldName);
    return buffer;
  }
}

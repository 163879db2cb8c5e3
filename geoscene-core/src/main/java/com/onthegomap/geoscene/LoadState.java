package com.onthegomap.geoscene;

/**
 * Where a {@link GeoJsonDataSource} is in loading its most recent document.
 */
public enum LoadState {
  /** Nothing has been loaded yet. */
  IDLE,
  /** Waiting for the document's coordinate reference system to resolve. The entity store is untouched. */
  RESOLVING_CRS,
  /** The entity store has been cleared and is being populated. */
  DISPATCHING,
  /** The last load finished and the entity store reflects its document. */
  DONE,
  /** The last load failed. */
  FAILED
}

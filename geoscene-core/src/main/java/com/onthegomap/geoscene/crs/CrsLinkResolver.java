package com.onthegomap.geoscene.crs;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.geo.CoordinateTransform;
import java.util.concurrent.CompletableFuture;

/**
 * Produces the {@link CoordinateTransform} for a linked coordinate reference system, possibly asynchronously (for
 * example by fetching the document the link points to).
 */
@FunctionalInterface
public interface CrsLinkResolver {

  /**
   * Returns a future that completes with the transform described by a crs link.
   *
   * @param properties the {@code properties} object of the link, containing {@code href} and optionally {@code type}
   */
  CompletableFuture<CoordinateTransform> resolve(JsonNode properties);

  /** Returns a resolver that always completes immediately with {@code transform}. */
  static CrsLinkResolver of(CoordinateTransform transform) {
    return properties -> CompletableFuture.completedFuture(transform);
  }
}

package com.onthegomap.geoscene.util;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches and parses a json document from a URL.
 */
@FunctionalInterface
public interface JsonFetcher {

  /**
   * Returns a future that completes with the parsed json at {@code url}, or fails with the error that prevented fetching
   * or parsing it. Implementations should not throw from this method.
   */
  CompletableFuture<JsonNode> fetchJson(String url);
}

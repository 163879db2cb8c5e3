package com.onthegomap.geoscene.config;

import java.time.Duration;

/**
 * Holder for common parameters used by many components in geoscene.
 */
public record GeoSceneConfig(
  Arguments arguments,
  String httpUserAgent,
  Duration httpTimeout,
  int httpRetries,
  Duration httpRetryWait
) {

  public GeoSceneConfig {
    if (httpRetries < 0) {
      throw new IllegalArgumentException("HTTP Retries must be >= 0, was " + httpRetries);
    }
    if (httpTimeout.isNegative() || httpTimeout.isZero()) {
      throw new IllegalArgumentException("HTTP timeout must be > 0, was " + httpTimeout);
    }
    if (httpRetryWait.isNegative()) {
      throw new IllegalArgumentException("HTTP retry wait must be >= 0, was " + httpRetryWait);
    }
  }

  public static GeoSceneConfig defaults() {
    return from(Arguments.of());
  }

  public static GeoSceneConfig from(Arguments arguments) {
    return new GeoSceneConfig(
      arguments,
      arguments.getString("http_user_agent", "User-Agent header to set when fetching geojson over HTTP",
        "GeoScene geojson loader (https://github.com/onthegomap/geoscene)"),
      arguments.getDuration("http_timeout", "Timeout to use when fetching geojson over HTTP", "30s"),
      arguments.getInteger("http_retries", "Retries to use when fetching geojson over HTTP", 1),
      arguments.getDuration("http_retry_wait", "How long to wait before retrying HTTP request", "5s")
    );
  }
}

package com.onthegomap.geoscene.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GeoSceneConfigTest {

  @Test
  void testDefaults() {
    GeoSceneConfig config = GeoSceneConfig.defaults();
    assertEquals(Duration.ofSeconds(30), config.httpTimeout());
    assertEquals(1, config.httpRetries());
    assertEquals(Duration.ofSeconds(5), config.httpRetryWait());
    assertTrue(config.httpUserAgent().startsWith("GeoScene"), config.httpUserAgent());
  }

  @Test
  void testFromArguments() {
    GeoSceneConfig config = GeoSceneConfig.from(Arguments.of(
      "http_timeout", "2s",
      "http_retries", "0",
      "http_retry_wait", "0s",
      "http_user_agent", "test-agent"
    ));
    assertEquals(Duration.ofSeconds(2), config.httpTimeout());
    assertEquals(0, config.httpRetries());
    assertEquals(Duration.ZERO, config.httpRetryWait());
    assertEquals("test-agent", config.httpUserAgent());
  }

  @ParameterizedTest
  @CsvSource({
    "http_retries, -1",
    "http_timeout, 0s",
    "http_timeout, -1s",
    "http_retry_wait, -1s",
  })
  void testRejectsInvalidValues(String key, String value) {
    Arguments arguments = Arguments.of(key, value);
    assertThrows(IllegalArgumentException.class, () -> GeoSceneConfig.from(arguments));
  }
}

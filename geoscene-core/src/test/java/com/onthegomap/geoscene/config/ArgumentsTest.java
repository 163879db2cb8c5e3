package com.onthegomap.geoscene.config;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.geoscene.TestUtils;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArgumentsTest {

  @Test
  void testFallbackWhenMissing() {
    assertEquals("fallback", Arguments.of().getString("input", "input", "fallback"));
  }

  @Test
  void testRequiredArgument() {
    var error = assertThrows(IllegalArgumentException.class, () -> Arguments.of().getString("input", "geojson url"));
    assertTrue(error.getMessage().contains("input"), error.getMessage());
    assertEquals("a.geojson", Arguments.of("input", "a.geojson").getString("input", "geojson url"));
  }

  @Test
  void testOrElse() {
    Arguments args = Arguments.of("input", "a.geojson", "output", "a.json")
      .orElse(Arguments.of("output", "b.json", "crs_alias", "EPSG:4979"));

    assertEquals("a.geojson", args.getString("input", "input", null));
    assertEquals("a.json", args.getString("output", "output", null));
    assertEquals("EPSG:4979", args.getString("crs_alias", "crs", null));
    assertNull(args.getString("http_timeout", "timeout", null));
  }

  @Test
  void testConfigFileParsing() {
    Arguments args = Arguments.fromConfigFile(TestUtils.pathToResource("test.properties"));
    assertEquals("data/sample.geojson", args.getString("input", "input", null));
    assertEquals(4, args.getInteger("http_retries", "retries", 1));
    assertEquals(Map.of("input", "data/sample.geojson", "http_retries", "4"), args.toMap());
  }

  @Test
  void testArgsOverrideConfigFile() {
    Arguments args = Arguments.fromArgsOrConfigFile(
      "config=" + TestUtils.pathToResource("test.properties"),
      "--http-retries=2"
    );
    assertEquals("data/sample.geojson", args.getString("input", "input", null));
    assertEquals(2, args.getInteger("http_retries", "retries", 1));
  }

  @Test
  void testMissingConfigFile() {
    assertThrows(IllegalArgumentException.class,
      () -> Arguments.fromConfigFile(TestUtils.pathToResource("missing.properties")));
  }

  @Test
  void testDuration() {
    Arguments args = Arguments.of("http_timeout", "1m30s");
    assertEquals(Duration.ofSeconds(90), args.getDuration("http_timeout", "timeout", "30s"));
    assertEquals(Duration.ofSeconds(5), args.getDuration("http_retry_wait", "wait", "5s"));
  }

  @Test
  void testList() {
    assertEquals(List.of("EPSG:4979", "urn:ogc:def:crs:EPSG::4326"),
      Arguments.of("crs_alias", "EPSG:4979, urn:ogc:def:crs:EPSG::4326,")
        .getList("crs_alias", "aliases", List.of()));
    assertEquals(List.of(), Arguments.of().getList("crs_alias", "aliases", List.of()));
  }

  @Test
  void testFlagWithoutValue() {
    Arguments args = Arguments.fromArgs("--crs-alias", "--input", "a.geojson");
    assertEquals("true", args.getString("crs_alias", "aliases", null));
    assertEquals("a.geojson", args.getString("input", "input", null));
  }

  @Test
  void testFile() {
    assertEquals(Path.of("out.json"), Arguments.of("output", "out.json").file("output", "output", null));
    assertNull(Arguments.of().file("output", "output", null));
  }

  @Test
  void testSeparatorsAreInterchangeable() {
    assertEquals("1s", Arguments.fromArgs("--http-retry-wait=1s").getString("http_retry_wait", "wait", null));
    assertEquals("1s", Arguments.fromArgs("--http_retry_wait", "1s").getString("http-retry-wait", "wait", null));
  }

  @Test
  void testFromEnvironment() {
    Map<String, String> env = Map.of(
      "OTHER", "value",
      "GEOSCENE_HTTP_RETRIES", "3",
      "GEOSCENE_INPUT", "x.geojson"
    );
    Arguments args = Arguments.fromEnvironment(env::get, env::keySet);
    assertEquals(Map.of("http_retries", "3", "input", "x.geojson"), args.toMap());
    assertEquals(3, args.getInteger("http_retries", "retries", 1));
  }

  @Test
  void testFromJvmProperties() {
    Map<String, String> jvm = Map.of(
      "java.version", "17",
      "geoscene.output", "out.json"
    );
    Arguments args = Arguments.fromJvmProperties(jvm::get, jvm::keySet);
    assertEquals(Map.of("output", "out.json"), args.toMap());
  }

  @Test
  void testDeprecatedKeyFallback() {
    assertEquals("a.geojson", Arguments.of("url", "a.geojson").getString("input|url", "input", null));
    assertEquals("b.geojson",
      Arguments.of("url", "a.geojson", "input", "b.geojson").getString("input|url", "input", null));
  }
}

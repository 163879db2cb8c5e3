package com.onthegomap.geoscene.reader.geojson;

import static com.onthegomap.geoscene.TestUtils.json;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.geoscene.entity.DefaultStyles;
import com.onthegomap.geoscene.entity.Entity;
import com.onthegomap.geoscene.entity.EntityCollection;
import com.onthegomap.geoscene.geo.Cartesian3;
import com.onthegomap.geoscene.geo.CoordinateTransform;
import com.onthegomap.geoscene.reader.GeoJsonException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GeoJsonDispatcherTest {

  private static final CoordinateTransform FLAT =
    c -> new Cartesian3(c.getX(), c.getY(), Double.isNaN(c.getZ()) ? 0 : c.getZ());

  private final EntityCollection entities = new EntityCollection();
  private final DefaultStyles styles = new DefaultStyles();
  private final AtomicInteger generated = new AtomicInteger();
  private final GeoJsonDispatcher dispatcher =
    new GeoJsonDispatcher(entities, styles, FLAT, () -> "gen-" + generated.incrementAndGet());

  private List<Entity> dispatch(String document) {
    dispatcher.dispatch(json(document));
    return List.copyOf(entities.values());
  }

  private static List<Cartesian3> path(double... xy) {
    List<Cartesian3> builder = new ArrayList<>();
    for (int i = 0; i < xy.length; i += 2) {
      builder.add(new Cartesian3(xy[i], xy[i + 1], 0));
    }
    return builder;
  }

  private GeoJsonException assertFails(GeoJsonException.Kind kind, String document) {
    var error = assertThrows(GeoJsonException.class, () -> dispatcher.dispatch(json(document)));
    assertEquals(kind, error.kind(), error.getMessage());
    return error;
  }

  @Test
  void testBarePoint() {
    var result = dispatch("""
      {"type": "Point", "coordinates": [-75.0, 40.0]}
      """);
    assertEquals(1, result.size());
    Entity entity = result.get(0);
    assertEquals("gen-1", entity.getId());
    assertEquals(new Cartesian3(-75, 40, 0), entity.getPosition());
    assertNull(entity.getVertexPositions());
    assertEquals(styles.getPoint().getPoint(), entity.getPoint());
    assertNotSame(styles.getPoint().getPoint(), entity.getPoint());
    assertNull(entity.getPolyline());
  }

  @Test
  void testPointWithHeight() {
    assertEquals(new Cartesian3(1, 2, 3), dispatch("""
      {"type": "Point", "coordinates": [1, 2, 3]}
      """).get(0).getPosition());
  }

  @Test
  void testFeaturePoint() {
    var result = dispatch("""
      {"type": "Feature", "id": "abc", "properties": {"name": "x"}, "geometry": {"type": "Point", "coordinates": [1, 2]}}
      """);
    assertEquals(1, result.size());
    assertEquals("abc", result.get(0).getId());
    assertEquals("x", result.get(0).getGeoJson().get("properties").get("name").asText());
  }

  @Test
  void testMultiPoint() {
    var result = dispatch("""
      {"type": "Feature", "id": "m", "geometry": {"type": "MultiPoint", "coordinates": [[1, 2], [3, 4], [5, 6]]}}
      """);
    assertEquals(List.of("m", "m_2", "m_3"), result.stream().map(Entity::getId).toList());
    assertEquals(new Cartesian3(5, 6, 0), result.get(2).getPosition());
    assertNotSame(result.get(0).getPoint(), result.get(1).getPoint());
  }

  @Test
  void testLineString() {
    var result = dispatch("""
      {"type": "LineString", "coordinates": [[0, 0], [1, 1], [2, 0]]}
      """);
    assertEquals(1, result.size());
    assertEquals(path(0, 0, 1, 1, 2, 0), result.get(0).getVertexPositions());
    assertNull(result.get(0).getPosition());
    assertEquals(styles.getLine().getPolyline(), result.get(0).getPolyline());
    assertNull(result.get(0).getPoint());
  }

  @Test
  void testMultiLineString() {
    var result = dispatch("""
      {"type": "MultiLineString", "coordinates": [[[0, 0], [1, 1]], [[2, 2], [3, 3]]]}
      """);
    assertEquals(2, result.size());
    assertEquals(path(2, 2, 3, 3), result.get(1).getVertexPositions());
  }

  @Test
  void testPolygonUsesOuterRing() {
    var result = dispatch("""
      {"type": "Polygon", "coordinates": [
        [[0, 0], [3, 0], [3, 3], [0, 3], [0, 0]],
        [[1, 1], [2, 1], [2, 2], [1, 2], [1, 1]]
      ]}
      """);
    assertEquals(1, result.size());
    Entity polygon = result.get(0);
    assertEquals(path(0, 0, 3, 0, 3, 3, 0, 3, 0, 0), polygon.getVertexPositions());
    assertEquals(styles.getPolygon().getPolygon(), polygon.getPolygon());
    assertEquals(styles.getPolygon().getPolyline(), polygon.getPolyline());
  }

  @Test
  void testPolygonWithoutRings() {
    var result = dispatch("""
      {"type": "Polygon", "coordinates": []}
      """);
    assertEquals(List.of(), result.get(0).getVertexPositions());
    assertNotNull(result.get(0).getPolygon());
  }

  @Test
  void testMultiPolygonProducesEntityPerPolygon() {
    var result = dispatch("""
      {"type": "Feature", "id": "mp", "geometry": {"type": "MultiPolygon", "coordinates": [
        [[[0, 0], [1, 0], [1, 1], [0, 0]]],
        [[[5, 5], [6, 5], [6, 6], [5, 5]], [[5.1, 5.1], [5.2, 5.1], [5.2, 5.2], [5.1, 5.1]]]
      ]}}
      """);
    assertEquals(List.of("mp", "mp_2"), result.stream().map(Entity::getId).toList());
    assertEquals(path(0, 0, 1, 0, 1, 1, 0, 0), result.get(0).getVertexPositions());
    assertEquals(path(5, 5, 6, 5, 6, 6, 5, 5), result.get(1).getVertexPositions());
  }

  @Test
  void testGeometryCollection() {
    var result = dispatch("""
      {"type": "Feature", "id": "g", "geometry": {"type": "GeometryCollection", "geometries": [
        {"type": "Point", "coordinates": [1, 2]},
        {"type": "LineString", "coordinates": [[0, 0], [1, 1]]},
        {"type": "GeometryCollection", "geometries": [
          {"type": "MultiPoint", "coordinates": [[7, 7], [8, 8]]}
        ]}
      ]}}
      """);
    assertEquals(List.of("g", "g_2", "g_3", "g_4"), result.stream().map(Entity::getId).toList());
    assertNotNull(result.get(0).getPoint());
    assertNotNull(result.get(1).getPolyline());
    assertEquals(new Cartesian3(8, 8, 0), result.get(3).getPosition());
  }

  @Test
  void testEmptyGeometryCollection() {
    assertEquals(List.of(), dispatch("""
      {"type": "GeometryCollection", "geometries": []}
      """));
  }

  @Test
  void testNullGeometry() {
    var result = dispatch("""
      {"type": "Feature", "id": "empty", "properties": {"a": 1}, "geometry": null}
      """);
    assertEquals(1, result.size());
    Entity entity = result.get(0);
    assertEquals("empty", entity.getId());
    assertFalse(entity.hasPosition());
    assertTrue(entity.isUnstyled());
    assertEquals(1, entity.getGeoJson().get("properties").get("a").asInt());
  }

  @Test
  void testEmptyPoint() {
    var result = dispatch("""
      {"type": "Point", "coordinates": []}
      """);
    assertEquals(1, result.size());
    assertFalse(result.get(0).hasPosition());
    assertNotNull(result.get(0).getPoint());
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
    "{\"type\": \"Point\", \"coordinates\": [1, 2]}| 1",
    "{\"type\": \"MultiPoint\", \"coordinates\": [[1, 2], [3, 4]]}| 2",
    "{\"type\": \"MultiPoint\", \"coordinates\": []}| 0",
    "{\"type\": \"LineString\", \"coordinates\": [[1, 2], [3, 4]]}| 1",
    "{\"type\": \"MultiLineString\", \"coordinates\": [[[1, 2], [3, 4]], [[1, 2], [3, 4]], [[1, 2], [3, 4]]]}| 3",
    "{\"type\": \"Polygon\", \"coordinates\": [[[1, 2], [3, 4], [1, 2]]]}| 1",
    "{\"type\": \"MultiPolygon\", \"coordinates\": [[[[1, 2], [3, 4], [1, 2]]], [[[1, 2], [3, 4], [1, 2]]]]}| 2",
  })
  void testFeatureCollectionCountIsSumOfExpansions(String geometry, int expected) {
    var result = dispatch("""
      {"type": "FeatureCollection", "features": [
        {"type": "Feature", "geometry": %s},
        {"type": "Feature", "geometry": {"type": "Point", "coordinates": [0, 0]}},
        {"type": "Feature", "geometry": null}
      ]}
      """.formatted(geometry));
    assertEquals(expected + 2, result.size());
  }

  @Test
  void testDuplicateFeatureIds() {
    var result = dispatch("""
      {"type": "FeatureCollection", "features": [
        {"type": "Feature", "id": "abc", "geometry": {"type": "Point", "coordinates": [1, 1]}},
        {"type": "Feature", "id": "abc", "geometry": {"type": "Point", "coordinates": [2, 2]}}
      ]}
      """);
    assertEquals(new Cartesian3(1, 1, 0), entities.get("abc").getPosition());
    assertEquals(new Cartesian3(2, 2, 0), entities.get("abc_2").getPosition());
    assertEquals(2, result.size());
  }

  @Test
  void testEmptyFeatureCollection() {
    assertEquals(List.of(), dispatch("""
      {"type": "FeatureCollection", "features": []}
      """));
  }

  @Test
  void testUsesCurrentTemplates() {
    styles.getPoint().getPoint().setPixelSize(42d);
    var result = dispatch("""
      {"type": "Point", "coordinates": [1, 2]}
      """);
    assertEquals(42d, result.get(0).getPoint().getPixelSize());
  }

  @Test
  void testUnknownGeometryType() {
    assertFails(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, """
      {"type": "Feature", "geometry": {"type": "Circle", "radius": 3}}
      """);
    assertFails(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, """
      {"type": "Feature", "geometry": {"type": "Feature", "geometry": null}}
      """);
  }

  @Test
  void testMissingGeometry() {
    assertFails(GeoJsonException.Kind.MISSING_GEOMETRY, """
      {"type": "Feature", "properties": {}}
      """);
  }

  @Test
  void testMissingMembers() {
    assertFails(GeoJsonException.Kind.MISSING_MEMBER, """
      {"type": "FeatureCollection"}
      """);
    assertFails(GeoJsonException.Kind.MISSING_MEMBER, """
      {"type": "GeometryCollection", "geometries": {}}
      """);
  }

  @Test
  void testInvalidCoordinates() {
    assertFails(GeoJsonException.Kind.INVALID_COORDINATES, """
      {"type": "LineString", "coordinates": [1, 2]}
      """);
    assertFails(GeoJsonException.Kind.INVALID_COORDINATES, """
      {"type": "Point"}
      """);
  }

  @Test
  void testUnsupportedDocumentType() {
    assertFails(GeoJsonException.Kind.UNSUPPORTED_DOCUMENT_TYPE, """
      {"type": "Widget"}
      """);
    assertEquals(0, entities.size());
  }

  @Test
  void testErrorKeepsEntitiesCreatedBeforeIt() {
    assertFails(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, """
      {"type": "FeatureCollection", "features": [
        {"type": "Feature", "id": "ok", "geometry": {"type": "Point", "coordinates": [1, 1]}},
        {"type": "Feature", "id": "bad", "geometry": {"type": "Sphere"}},
        {"type": "Feature", "id": "never", "geometry": {"type": "Point", "coordinates": [1, 1]}}
      ]}
      """);
    assertTrue(entities.exists("ok"));
    assertFalse(entities.exists("bad"));
    assertFalse(entities.exists("never"));
  }
}

package com.onthegomap.geoscene.reader.geojson;

import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.MISSING_MEMBER;
import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.entity.DefaultStyles;
import com.onthegomap.geoscene.geo.Cartesian3;
import com.onthegomap.geoscene.geo.CoordinateTransform;
import com.onthegomap.geoscene.reader.GeoJsonException;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;

/**
 * Turns a geojson geometry into positioned, styled entities.
 * <p>
 * Each point becomes an entity with a single position, and each line string or polygon becomes an entity with a path
 * of vertex positions. Multi-geometries produce one entity per part. Only the outer ring of a polygon is used, holes
 * are dropped. Coordinates keep their order with no de-duplication or winding correction.
 */
class GeometryDecoder {

  private final EntityIdResolver ids;
  private final DefaultStyles styles;
  private final CoordinateTransform crs;

  GeometryDecoder(EntityIdResolver ids, DefaultStyles styles, CoordinateTransform crs) {
    this.ids = ids;
    this.styles = styles;
    this.crs = crs;
  }

  /**
   * Creates the entities for {@code geometry}.
   *
   * @param owner    the object entity ids come from: the enclosing {@code Feature}, or the geometry itself at the root
   * @param geometry the geometry object
   * @param type     the parsed {@code type} of {@code geometry}
   */
  void decode(JsonNode owner, JsonNode geometry, GeoJsonType type) {
    switch (type) {
      case POINT -> point(owner, GeoJsonCoordinates.coordinates(geometry));
      case MULTI_POINT -> {
        for (JsonNode position : GeoJsonCoordinates.elements(GeoJsonCoordinates.coordinates(geometry))) {
          point(owner, position);
        }
      }
      case LINE_STRING -> line(owner, GeoJsonCoordinates.coordinates(geometry));
      case MULTI_LINE_STRING -> {
        for (JsonNode line : GeoJsonCoordinates.elements(GeoJsonCoordinates.coordinates(geometry))) {
          line(owner, line);
        }
      }
      case POLYGON -> polygon(owner, GeoJsonCoordinates.coordinates(geometry));
      case MULTI_POLYGON -> {
        for (JsonNode polygon : GeoJsonCoordinates.elements(GeoJsonCoordinates.coordinates(geometry))) {
          polygon(owner, polygon);
        }
      }
      case GEOMETRY_COLLECTION -> geometryCollection(owner, geometry);
      case FEATURE, FEATURE_COLLECTION -> throw new GeoJsonException(UNKNOWN_GEOMETRY_TYPE,
        "Unknown geometry type: " + type.typeName());
    }
  }

  private void geometryCollection(JsonNode owner, JsonNode collection) {
    JsonNode geometries = collection.get("geometries");
    if (geometries == null || !geometries.isArray()) {
      throw new GeoJsonException(MISSING_MEMBER, "GeometryCollection.geometries must be an array, got: " + geometries);
    }
    for (JsonNode geometry : geometries) {
      decode(owner, geometry, GeoJsonType.parseGeometry(geometry));
    }
  }

  private void point(JsonNode owner, JsonNode position) {
    if (position != null && position.isArray() && position.isEmpty()) {
      // degenerate point: styled but never positioned
      ids.create(owner).merge(styles.getPoint());
      return;
    }
    Cartesian3 cartesian = crs.transform(GeoJsonCoordinates.position(position));
    ids.create(owner)
      .merge(styles.getPoint())
      .setPosition(cartesian);
  }

  private void line(JsonNode owner, JsonNode positions) {
    List<Cartesian3> path = transform(GeoJsonCoordinates.positions(positions));
    ids.create(owner)
      .merge(styles.getLine())
      .setVertexPositions(path);
  }

  private void polygon(JsonNode owner, JsonNode rings) {
    List<JsonNode> ringList = GeoJsonCoordinates.elements(rings);
    // TODO interior rings (holes) need a polygon hierarchy on Entity before they can be kept
    List<Cartesian3> outer = ringList.isEmpty() ? List.of() : transform(GeoJsonCoordinates.positions(ringList.get(0)));
    ids.create(owner)
      .merge(styles.getPolygon())
      .setVertexPositions(outer);
  }

  private List<Cartesian3> transform(List<Coordinate> coordinates) {
    List<Cartesian3> result = new ArrayList<>(coordinates.size());
    for (Coordinate coordinate : coordinates) {
      result.add(crs.transform(coordinate));
    }
    return result;
  }
}

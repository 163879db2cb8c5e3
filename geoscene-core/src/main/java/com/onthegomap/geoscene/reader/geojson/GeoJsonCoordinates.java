package com.onthegomap.geoscene.reader.geojson;

import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.INVALID_COORDINATES;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.reader.GeoJsonException;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;

/**
 * Utilities to read the nested position arrays of a geojson {@code coordinates} member.
 * <p>
 * Positions are read exactly as given: the first element goes to {@code x}, the second to {@code y}, and a third (if
 * present) to {@code z}. Extra elements are ignored.
 */
class GeoJsonCoordinates {
  private GeoJsonCoordinates() {}

  /** Returns the {@code coordinates} array of {@code geometry}. */
  static JsonNode coordinates(JsonNode geometry) {
    JsonNode coordinates = geometry.get("coordinates");
    if (coordinates == null || !coordinates.isArray()) {
      throw new GeoJsonException(INVALID_COORDINATES,
        "Expecting coordinates array in " + GeoJsonType.typeName(geometry) + " but got: " + coordinates);
    }
    return coordinates;
  }

  /** Returns a single position {@code [x, y]} or {@code [x, y, z]}. */
  static Coordinate position(JsonNode position) {
    if (position == null || !position.isArray() || position.size() < 2) {
      throw new GeoJsonException(INVALID_COORDINATES, "Invalid geojson position: " + position);
    }
    double x = number(position, 0);
    double y = number(position, 1);
    return position.size() >= 3 ? new Coordinate(x, y, number(position, 2)) : new Coordinate(x, y);
  }

  /** Returns an array of positions, like the coordinates of a {@code LineString} or a polygon ring. */
  static List<Coordinate> positions(JsonNode positions) {
    List<JsonNode> items = elements(positions);
    List<Coordinate> result = new ArrayList<>(items.size());
    for (JsonNode item : items) {
      result.add(position(item));
    }
    return result;
  }

  /** Returns the elements of an array one level up from positions, failing if {@code node} is not an array. */
  static List<JsonNode> elements(JsonNode node) {
    if (node == null || !node.isArray()) {
      throw new GeoJsonException(INVALID_COORDINATES, "Expecting list in geojson geometry but got: " + node);
    }
    List<JsonNode> result = new ArrayList<>(node.size());
    node.elements().forEachRemaining(result::add);
    return result;
  }

  private static double number(JsonNode position, int index) {
    JsonNode value = position.get(index);
    if (!value.isNumber()) {
      throw new GeoJsonException(INVALID_COORDINATES, "Invalid geojson position: " + position);
    }
    return value.doubleValue();
  }
}

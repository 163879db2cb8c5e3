package com.onthegomap.geoscene.reader.geojson;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.reader.GeoJsonException;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The geojson object types that can appear as a document root, with the geometry types also allowed inside
 * {@code Feature.geometry} and {@code GeometryCollection.geometries}.
 * <p>
 * Type names are matched case-sensitively with no aliases.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7946#section-1.4">RFC 7946 section 1.4</a>
 */
public enum GeoJsonType {
  FEATURE("Feature", false),
  FEATURE_COLLECTION("FeatureCollection", false),
  GEOMETRY_COLLECTION("GeometryCollection", true),
  POINT("Point", true),
  MULTI_POINT("MultiPoint", true),
  LINE_STRING("LineString", true),
  MULTI_LINE_STRING("MultiLineString", true),
  POLYGON("Polygon", true),
  MULTI_POLYGON("MultiPolygon", true);

  private static final Map<String, GeoJsonType> BY_NAME = Arrays.stream(values())
    .collect(Collectors.toUnmodifiableMap(GeoJsonType::typeName, Function.identity()));

  private final String typeName;
  private final boolean geometry;

  GeoJsonType(String typeName, boolean geometry) {
    this.typeName = typeName;
    this.geometry = geometry;
  }

  /** Returns the value of the {@code type} member for this kind of object. */
  public String typeName() {
    return typeName;
  }

  /** Returns true if objects of this type can appear where a geometry is expected. */
  public boolean isGeometry() {
    return geometry;
  }

  /** Returns the type named {@code name}, or {@code null} if there is none. */
  public static GeoJsonType fromName(String name) {
    return name == null ? null : BY_NAME.get(name);
  }

  /**
   * Returns the type of a document root.
   *
   * @throws GeoJsonException of kind {@code UNSUPPORTED_DOCUMENT_TYPE} if the type is missing or unrecognized
   */
  public static GeoJsonType parseDocument(JsonNode object) {
    String name = typeName(object);
    GeoJsonType type = fromName(name);
    if (type == null) {
      throw new GeoJsonException(GeoJsonException.Kind.UNSUPPORTED_DOCUMENT_TYPE,
        "Unsupported GeoJSON object type: " + name);
    }
    return type;
  }

  /**
   * Returns the type of an object in geometry position.
   *
   * @throws GeoJsonException of kind {@code UNKNOWN_GEOMETRY_TYPE} if the type is missing, unrecognized, or not a
   *                          geometry type
   */
  public static GeoJsonType parseGeometry(JsonNode object) {
    String name = typeName(object);
    GeoJsonType type = fromName(name);
    if (type == null || !type.isGeometry()) {
      throw new GeoJsonException(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, "Unknown geometry type: " + name);
    }
    return type;
  }

  /** Returns the text of the {@code type} member of {@code object}, or {@code null} if it has none. */
  static String typeName(JsonNode object) {
    JsonNode type = object == null ? null : object.get("type");
    return type == null || !type.isTextual() ? null : type.textValue();
  }
}

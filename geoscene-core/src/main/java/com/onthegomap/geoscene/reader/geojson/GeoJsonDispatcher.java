package com.onthegomap.geoscene.reader.geojson;

import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.MISSING_GEOMETRY;
import static com.onthegomap.geoscene.reader.GeoJsonException.Kind.MISSING_MEMBER;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.entity.DefaultStyles;
import com.onthegomap.geoscene.entity.EntityStore;
import com.onthegomap.geoscene.geo.CoordinateTransform;
import com.onthegomap.geoscene.reader.GeoJsonException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Walks a geojson document and adds an entity to an {@link EntityStore} for every geometry it contains.
 * <p>
 * The root may be a {@code Feature}, a {@code FeatureCollection}, or any geometry including a
 * {@code GeometryCollection}. Entities are created in document order using one {@link CoordinateTransform} for the
 * whole document. A {@code Feature} with a {@code null} geometry produces a single entity with no graphics or position.
 * <p>
 * Nothing is rolled back on failure: entities created before an invalid object stay in the store.
 */
public class GeoJsonDispatcher {

  private final EntityIdResolver ids;
  private final GeometryDecoder geometries;

  public GeoJsonDispatcher(EntityStore entities, DefaultStyles styles, CoordinateTransform crs) {
    this(new EntityIdResolver(entities), styles, crs);
  }

  /** Creates a dispatcher that names entities that don't come from a {@code Feature id} with {@code idGenerator}. */
  public GeoJsonDispatcher(EntityStore entities, DefaultStyles styles, CoordinateTransform crs,
    Supplier<String> idGenerator) {
    this(new EntityIdResolver(entities, idGenerator), styles, crs);
  }

  private GeoJsonDispatcher(EntityIdResolver ids, DefaultStyles styles, CoordinateTransform crs) {
    this.ids = ids;
    this.geometries = new GeometryDecoder(ids,
      Objects.requireNonNull(styles, "styles"),
      Objects.requireNonNull(crs, "crs"));
  }

  /** Parses the type of {@code document} and adds entities for it. */
  public void dispatch(JsonNode document) {
    dispatch(document, GeoJsonType.parseDocument(document));
  }

  /** Adds entities for {@code document} that has already been parsed as {@code type}. */
  public void dispatch(JsonNode document, GeoJsonType type) {
    switch (type) {
      case FEATURE -> feature(document);
      case FEATURE_COLLECTION -> featureCollection(document);
      case GEOMETRY_COLLECTION, POINT, MULTI_POINT, LINE_STRING, MULTI_LINE_STRING, POLYGON, MULTI_POLYGON ->
        geometries.decode(document, document, type);
    }
  }

  private void featureCollection(JsonNode collection) {
    JsonNode features = collection.get("features");
    if (features == null || !features.isArray()) {
      throw new GeoJsonException(MISSING_MEMBER, "FeatureCollection.features must be an array, got: " + features);
    }
    for (JsonNode feature : features) {
      feature(feature);
    }
  }

  private void feature(JsonNode feature) {
    JsonNode geometry = feature.get("geometry");
    if (geometry == null) {
      throw new GeoJsonException(MISSING_GEOMETRY, "feature.geometry is required.");
    }
    if (geometry.isNull()) {
      // attribute-only feature
      ids.create(feature);
    } else {
      geometries.decode(feature, geometry, GeoJsonType.parseGeometry(geometry));
    }
  }
}

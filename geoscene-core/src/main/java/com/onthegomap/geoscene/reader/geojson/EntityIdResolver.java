package com.onthegomap.geoscene.reader.geojson;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.entity.Entity;
import com.onthegomap.geoscene.entity.EntityStore;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates the entity for a geojson object and picks its id.
 * <p>
 * Only a {@code Feature} has a usable {@code id}. The first entity made for it keeps that id verbatim and any later one
 * (from a duplicate id or from each part of a multi-geometry) gets the first free {@code id_2}, {@code id_3}, ...
 * Everything else gets a random UUID.
 */
class EntityIdResolver {

  private final EntityStore entities;
  private final Supplier<String> idGenerator;

  EntityIdResolver(EntityStore entities) {
    this(entities, () -> UUID.randomUUID().toString());
  }

  EntityIdResolver(EntityStore entities, Supplier<String> idGenerator) {
    this.entities = entities;
    this.idGenerator = idGenerator;
  }

  /** Returns the id the next entity created for {@code object} would get. */
  String resolveId(JsonNode object) {
    JsonNode id = object.get("id");
    if (id == null || id.isNull() || GeoJsonType.fromName(GeoJsonType.typeName(object)) != GeoJsonType.FEATURE) {
      return idGenerator.get();
    }
    // 1.0 and 1 name the same feature
    String base = id.isNumber() && id.canConvertToExactIntegral() ? id.bigIntegerValue().toString() : id.asText();
    String result = base;
    for (int i = 2; entities.exists(result); i++) {
      result = base + "_" + i;
    }
    return result;
  }

  /** Creates a new entity for {@code object} with a unique id and a reference back to {@code object}. */
  Entity create(JsonNode object) {
    return entities.getOrCreate(resolveId(object)).setGeoJson(object);
  }
}

package com.onthegomap.geoscene.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.entity.graphics.PointGraphics;
import com.onthegomap.geoscene.entity.graphics.PolygonGraphics;
import com.onthegomap.geoscene.entity.graphics.PolylineGraphics;
import com.onthegomap.geoscene.geo.Cartesian3;
import java.util.List;
import java.util.Objects;

/**
 * A renderer-agnostic scene object: an identity, the geojson it came from, the graphics used to draw it, and either a
 * single position or a path of vertex positions.
 * <p>
 * Positions are time-invariant and can only be assigned once.
 */
public class Entity {

  private final String id;
  private JsonNode geoJson;
  private PointGraphics point;
  private PolylineGraphics polyline;
  private PolygonGraphics polygon;
  private Cartesian3 position;
  private List<Cartesian3> vertexPositions;

  public Entity(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  public String getId() {
    return id;
  }

  /** Returns the raw geojson object this entity was created from, or {@code null} for entities created elsewhere. */
  public JsonNode getGeoJson() {
    return geoJson;
  }

  public Entity setGeoJson(JsonNode geoJson) {
    this.geoJson = geoJson;
    return this;
  }

  public PointGraphics getPoint() {
    return point;
  }

  public Entity setPoint(PointGraphics point) {
    this.point = point;
    return this;
  }

  public PolylineGraphics getPolyline() {
    return polyline;
  }

  public Entity setPolyline(PolylineGraphics polyline) {
    this.polyline = polyline;
    return this;
  }

  public PolygonGraphics getPolygon() {
    return polygon;
  }

  public Entity setPolygon(PolygonGraphics polygon) {
    this.polygon = polygon;
    return this;
  }

  public Cartesian3 getPosition() {
    return position;
  }

  /**
   * Sets the single position of this entity.
   *
   * @throws IllegalStateException if a position or vertex positions were already assigned
   */
  public Entity setPosition(Cartesian3 position) {
    checkPositionUnset();
    this.position = Objects.requireNonNull(position, "position");
    return this;
  }

  public List<Cartesian3> getVertexPositions() {
    return vertexPositions;
  }

  /**
   * Sets the ordered vertex path of this entity.
   *
   * @throws IllegalStateException if a position or vertex positions were already assigned
   */
  public Entity setVertexPositions(List<Cartesian3> vertexPositions) {
    checkPositionUnset();
    this.vertexPositions = List.copyOf(vertexPositions);
    return this;
  }

  public boolean hasPosition() {
    return position != null || vertexPositions != null;
  }

  /** Returns true if no graphics have been assigned to this entity. */
  public boolean isUnstyled() {
    return point == null && polyline == null && polygon == null;
  }

  private void checkPositionUnset() {
    if (hasPosition()) {
      throw new IllegalStateException("Position of " + id + " is already set");
    }
  }

  /**
   * Overlays the graphics of {@code template} onto this entity.
   * <p>
   * Graphics this entity lacks are copied from the template, and graphics it already has only receive the properties
   * they leave unset. The template is never modified, and nothing is shared with it, so later edits to the template do
   * not affect this entity.
   */
  public Entity merge(Entity template) {
    if (template != null) {
      if (template.point != null) {
        point = point == null ? template.point.copy() : point.merge(template.point);
      }
      if (template.polyline != null) {
        polyline = polyline == null ? template.polyline.copy() : polyline.merge(template.polyline);
      }
      if (template.polygon != null) {
        polygon = polygon == null ? template.polygon.copy() : polygon.merge(template.polygon);
      }
    }
    return this;
  }

  @Override
  public String toString() {
    return "Entity{id='" + id + "'" +
      (position != null ? ", position=" + position : "") +
      (vertexPositions != null ? ", vertexPositions=" + vertexPositions.size() : "") +
      (point != null ? ", " + point : "") +
      (polyline != null ? ", " + polyline : "") +
      (polygon != null ? ", " + polygon : "") +
      '}';
  }
}

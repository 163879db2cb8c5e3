package com.onthegomap.geoscene.entity;

import com.onthegomap.geoscene.entity.graphics.Color;
import com.onthegomap.geoscene.entity.graphics.PointGraphics;
import com.onthegomap.geoscene.entity.graphics.PolygonGraphics;
import com.onthegomap.geoscene.entity.graphics.PolylineGraphics;
import com.onthegomap.geoscene.entity.graphics.SolidColorMaterial;
import java.util.Objects;

/**
 * The style templates merged onto every entity of a geometry family, since geojson has no styling of its own.
 * <p>
 * The templates are plain entities that can be edited or replaced between loads. Loading only copies from them.
 */
public class DefaultStyles {

  public static final String DEFAULT_POINT_ID = "GeoJsonDataSource.defaultPoint";
  public static final String DEFAULT_LINE_ID = "GeoJsonDataSource.defaultLine";
  public static final String DEFAULT_POLYGON_ID = "GeoJsonDataSource.defaultPolygon";

  private Entity point;
  private Entity line;
  private Entity polygon;

  public DefaultStyles() {
    this(defaultPoint(), defaultLine(), defaultPolygon());
  }

  public DefaultStyles(Entity point, Entity line, Entity polygon) {
    setPoint(point);
    setLine(line);
    setPolygon(polygon);
  }

  /** Yellow 10px point with a 1px black outline. */
  public static Entity defaultPoint() {
    return new Entity(DEFAULT_POINT_ID).setPoint(new PointGraphics()
      .setColor(Color.YELLOW)
      .setPixelSize(10d)
      .setOutlineColor(Color.BLACK)
      .setOutlineWidth(1d));
  }

  /** Yellow 2px line with a 1px black outline. */
  public static Entity defaultLine() {
    return new Entity(DEFAULT_LINE_ID).setPolyline(new PolylineGraphics()
      .setColor(Color.YELLOW)
      .setWidth(2d)
      .setOutlineColor(Color.BLACK)
      .setOutlineWidth(1d));
  }

  /** Translucent yellow fill with a 1px yellow border. */
  public static Entity defaultPolygon() {
    return new Entity(DEFAULT_POLYGON_ID)
      .setPolyline(new PolylineGraphics()
        .setColor(Color.YELLOW)
        .setWidth(1d)
        .setOutlineColor(Color.BLACK)
        .setOutlineWidth(0d))
      .setPolygon(new PolygonGraphics()
        .setMaterial(new SolidColorMaterial(Color.fromBytes(255, 255, 0, 25))));
  }

  /** Template for {@code Point} and {@code MultiPoint} geometries. */
  public Entity getPoint() {
    return point;
  }

  public void setPoint(Entity point) {
    this.point = Objects.requireNonNull(point, "point");
  }

  /** Template for {@code LineString} and {@code MultiLineString} geometries. */
  public Entity getLine() {
    return line;
  }

  public void setLine(Entity line) {
    this.line = Objects.requireNonNull(line, "line");
  }

  /** Template for {@code Polygon} and {@code MultiPolygon} geometries. */
  public Entity getPolygon() {
    return polygon;
  }

  public void setPolygon(Entity polygon) {
    this.polygon = Objects.requireNonNull(polygon, "polygon");
  }
}

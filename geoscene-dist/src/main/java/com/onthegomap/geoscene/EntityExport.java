package com.onthegomap.geoscene;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geoscene.entity.Entity;
import com.onthegomap.geoscene.entity.graphics.Color;
import com.onthegomap.geoscene.entity.graphics.PointGraphics;
import com.onthegomap.geoscene.entity.graphics.PolygonGraphics;
import com.onthegomap.geoscene.entity.graphics.PolylineGraphics;
import com.onthegomap.geoscene.geo.Cartesian3;
import java.util.List;

/**
 * JSON-friendly view of an {@link Entity}: positions as {@code [x, y, z]} arrays and colors as css hex strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntityExport(
  String id,
  String family,
  double[] position,
  List<double[]> vertexPositions,
  Point point,
  Polyline polyline,
  Polygon polygon,
  JsonNode geoJson
) {

  public static EntityExport from(Entity entity) {
    return new EntityExport(
      entity.getId(),
      family(entity),
      entity.getPosition() == null ? null : entity.getPosition().toArray(),
      entity.getVertexPositions() == null ? null :
        entity.getVertexPositions().stream().map(Cartesian3::toArray).toList(),
      Point.from(entity.getPoint()),
      Polyline.from(entity.getPolyline()),
      Polygon.from(entity.getPolygon()),
      entity.getGeoJson()
    );
  }

  /** Returns which kind of graphics {@code entity} is drawn with, or {@code "unstyled"} for placeholders. */
  public static String family(Entity entity) {
    if (entity.getPolygon() != null) {
      return "polygon";
    } else if (entity.getPolyline() != null) {
      return "polyline";
    } else if (entity.getPoint() != null) {
      return "point";
    }
    return "unstyled";
  }

  private static String hex(Color color) {
    return color == null ? null : color.toCssHex();
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Point(String color, Double pixelSize, String outlineColor, Double outlineWidth) {

    static Point from(PointGraphics graphics) {
      return graphics == null ? null : new Point(hex(graphics.getColor()), graphics.getPixelSize(),
        hex(graphics.getOutlineColor()), graphics.getOutlineWidth());
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Polyline(String color, Double width, String outlineColor, Double outlineWidth) {

    static Polyline from(PolylineGraphics graphics) {
      return graphics == null ? null : new Polyline(hex(graphics.getColor()), graphics.getWidth(),
        hex(graphics.getOutlineColor()), graphics.getOutlineWidth());
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Polygon(String material) {

    static Polygon from(PolygonGraphics graphics) {
      return graphics == null ? null :
        new Polygon(graphics.getMaterial() == null ? null : hex(graphics.getMaterial().color()));
    }
  }
}

package com.onthegomap.geoscene.entity.graphics;

import java.util.Objects;

/**
 * How to draw the vertex positions of an entity as a line. Unset properties are {@code null}.
 */
public class PolylineGraphics {

  private Color color;
  private Double width;
  private Color outlineColor;
  private Double outlineWidth;

  public Color getColor() {
    return color;
  }

  public PolylineGraphics setColor(Color color) {
    this.color = color;
    return this;
  }

  public Double getWidth() {
    return width;
  }

  public PolylineGraphics setWidth(Double width) {
    this.width = width;
    return this;
  }

  public Color getOutlineColor() {
    return outlineColor;
  }

  public PolylineGraphics setOutlineColor(Color outlineColor) {
    this.outlineColor = outlineColor;
    return this;
  }

  public Double getOutlineWidth() {
    return outlineWidth;
  }

  public PolylineGraphics setOutlineWidth(Double outlineWidth) {
    this.outlineWidth = outlineWidth;
    return this;
  }

  /** Fills every property not set on this instance from {@code source}. */
  public PolylineGraphics merge(PolylineGraphics source) {
    if (source != null) {
      color = color != null ? color : source.color;
      width = width != null ? width : source.width;
      outlineColor = outlineColor != null ? outlineColor : source.outlineColor;
      outlineWidth = outlineWidth != null ? outlineWidth : source.outlineWidth;
    }
    return this;
  }

  public PolylineGraphics copy() {
    return new PolylineGraphics().merge(this);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PolylineGraphics other &&
      Objects.equals(color, other.color) &&
      Objects.equals(width, other.width) &&
      Objects.equals(outlineColor, other.outlineColor) &&
      Objects.equals(outlineWidth, other.outlineWidth));
  }

  @Override
  public int hashCode() {
    return Objects.hash(color, width, outlineColor, outlineWidth);
  }

  @Override
  public String toString() {
    return "PolylineGraphics{color=" + color + ", width=" + width + ", outlineColor=" + outlineColor +
      ", outlineWidth=" + outlineWidth + '}';
  }
}

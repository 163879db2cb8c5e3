package com.onthegomap.geoscene.entity.graphics;

import java.util.Objects;

/**
 * How to draw an entity with a single position as a point. Unset properties are {@code null}.
 */
public class PointGraphics {

  private Color color;
  private Double pixelSize;
  private Color outlineColor;
  private Double outlineWidth;

  public Color getColor() {
    return color;
  }

  public PointGraphics setColor(Color color) {
    this.color = color;
    return this;
  }

  public Double getPixelSize() {
    return pixelSize;
  }

  public PointGraphics setPixelSize(Double pixelSize) {
    this.pixelSize = pixelSize;
    return this;
  }

  public Color getOutlineColor() {
    return outlineColor;
  }

  public PointGraphics setOutlineColor(Color outlineColor) {
    this.outlineColor = outlineColor;
    return this;
  }

  public Double getOutlineWidth() {
    return outlineWidth;
  }

  public PointGraphics setOutlineWidth(Double outlineWidth) {
    this.outlineWidth = outlineWidth;
    return this;
  }

  /** Fills every property not set on this instance from {@code source}. */
  public PointGraphics merge(PointGraphics source) {
    if (source != null) {
      color = color != null ? color : source.color;
      pixelSize = pixelSize != null ? pixelSize : source.pixelSize;
      outlineColor = outlineColor != null ? outlineColor : source.outlineColor;
      outlineWidth = outlineWidth != null ? outlineWidth : source.outlineWidth;
    }
    return this;
  }

  public PointGraphics copy() {
    return new PointGraphics().merge(this);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PointGraphics other &&
      Objects.equals(color, other.color) &&
      Objects.equals(pixelSize, other.pixelSize) &&
      Objects.equals(outlineColor, other.outlineColor) &&
      Objects.equals(outlineWidth, other.outlineWidth));
  }

  @Override
  public int hashCode() {
    return Objects.hash(color, pixelSize, outlineColor, outlineWidth);
  }

  @Override
  public String toString() {
    return "PointGraphics{color=" + color + ", pixelSize=" + pixelSize + ", outlineColor=" + outlineColor +
      ", outlineWidth=" + outlineWidth + '}';
  }
}

package com.onthegomap.geoscene.entity.graphics;

import java.util.Objects;

/**
 * How to fill the area enclosed by the vertex positions of an entity.
 */
public class PolygonGraphics {

  private SolidColorMaterial material;

  public SolidColorMaterial getMaterial() {
    return material;
  }

  public PolygonGraphics setMaterial(SolidColorMaterial material) {
    this.material = material;
    return this;
  }

  /** Fills every property not set on this instance from {@code source}. */
  public PolygonGraphics merge(PolygonGraphics source) {
    if (source != null && material == null) {
      material = source.material;
    }
    return this;
  }

  public PolygonGraphics copy() {
    return new PolygonGraphics().merge(this);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PolygonGraphics other && Objects.equals(material, other.material));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(material);
  }

  @Override
  public String toString() {
    return "PolygonGraphics{material=" + material + '}';
  }
}

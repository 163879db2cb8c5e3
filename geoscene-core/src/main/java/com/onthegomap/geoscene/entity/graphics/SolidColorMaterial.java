package com.onthegomap.geoscene.entity.graphics;

import java.util.Objects;

/** A material that fills a surface with a single color. */
public record SolidColorMaterial(Color color) {
  public SolidColorMaterial {
    Objects.requireNonNull(color, "color");
  }
}

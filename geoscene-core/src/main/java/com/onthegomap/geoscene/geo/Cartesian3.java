package com.onthegomap.geoscene.geo;

/**
 * A position in an Earth-centered, Earth-fixed frame, in meters.
 */
public record Cartesian3(double x, double y, double z) {

  public static final Cartesian3 ZERO = new Cartesian3(0, 0, 0);

  public double magnitude() {
    return Math.sqrt(x * x + y * y + z * z);
  }

  public double distance(Cartesian3 other) {
    double dx = x - other.x;
    double dy = y - other.y;
    double dz = z - other.z;
    return Math.sqrt(dx * dx + dy * dy + dz * dz);
  }

  /** Returns a copy of this position as a {@code [x, y, z]} array. */
  public double[] toArray() {
    return new double[]{x, y, z};
  }
}

package com.onthegomap.geoscene.geo;

import org.locationtech.jts.geom.Coordinate;

/**
 * An ellipsoid of revolution used to convert geodetic (cartographic) coordinates into Earth-fixed cartesian ones.
 *
 * @param equatorialRadius semi-major axis in meters
 * @param polarRadius      semi-minor axis in meters
 */
public record Ellipsoid(double equatorialRadius, double polarRadius) {

  public static final Ellipsoid WGS84 = new Ellipsoid(6_378_137.0, 6_356_752.314_245_179_3);
  private static final double RADIANS_PER_DEGREE = Math.PI / 180;

  public Ellipsoid {
    if (!(equatorialRadius > 0) || !(polarRadius > 0)) {
      throw new IllegalArgumentException(
        "Ellipsoid radii must be > 0, got: " + equatorialRadius + ", " + polarRadius);
    }
  }

  /** Returns the square of the first eccentricity. */
  public double eccentricitySquared() {
    return 1 - (polarRadius * polarRadius) / (equatorialRadius * equatorialRadius);
  }

  /**
   * Returns the cartesian position of {@code longitude}/{@code latitude} in radians at {@code height} meters above the
   * surface of this ellipsoid.
   */
  public Cartesian3 cartographicToCartesian(double longitude, double latitude, double height) {
    double sinLat = Math.sin(latitude);
    double cosLat = Math.cos(latitude);
    double e2 = eccentricitySquared();
    // prime vertical radius of curvature
    double n = equatorialRadius / Math.sqrt(1 - e2 * sinLat * sinLat);
    return new Cartesian3(
      (n + height) * cosLat * Math.cos(longitude),
      (n + height) * cosLat * Math.sin(longitude),
      (n * (1 - e2) + height) * sinLat
    );
  }

  /**
   * Returns the cartesian position of a coordinate with longitude in {@code x} and latitude in {@code y} as degrees, and
   * an optional height in meters in {@code z} that defaults to 0 when it is {@link Coordinate#NULL_ORDINATE}.
   */
  public Cartesian3 cartographicDegreesToCartesian(Coordinate coordinate) {
    double height = Double.isNaN(coordinate.getZ()) ? 0 : coordinate.getZ();
    return cartographicToCartesian(
      coordinate.getX() * RADIANS_PER_DEGREE,
      coordinate.getY() * RADIANS_PER_DEGREE,
      height
    );
  }
}

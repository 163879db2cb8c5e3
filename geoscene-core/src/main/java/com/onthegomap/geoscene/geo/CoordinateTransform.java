package com.onthegomap.geoscene.geo;

import org.locationtech.jts.geom.Coordinate;

/**
 * Converts a raw geojson position into an Earth-fixed {@link Cartesian3}.
 * <p>
 * The input coordinate carries the position's first element in {@code x}, the second in {@code y}, and the third in
 * {@code z}, or {@link Coordinate#NULL_ORDINATE} when the position only had two elements. Implementations must be pure
 * functions of their input since the same transform is applied to every coordinate of a document.
 */
@FunctionalInterface
public interface CoordinateTransform {

  /** Treats coordinates as WGS84 longitude/latitude degrees with an optional height in meters. */
  CoordinateTransform WGS84 = Ellipsoid.WGS84::cartographicDegreesToCartesian;

  Cartesian3 transform(Coordinate coordinate);
}

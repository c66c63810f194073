package org.osp.xrit.domain.geo;

/**
 * Geodetic latitude/longitude pair in degrees.
 *
 * @param latitudeDeg latitude, positive north
 * @param longitudeDeg longitude in {@code [-180, 180]}, positive east
 * @since 0.1.0
 */
public record GeodeticCoordinate(double latitudeDeg, double longitudeDeg) {}

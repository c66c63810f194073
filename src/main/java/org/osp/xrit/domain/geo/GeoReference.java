package org.osp.xrit.domain.geo;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Forward and inverse transform between a geostationary imager's pixel grid and
 * geodetic coordinates.
 * <p><strong>Why:</strong> Overlays, crops and map reprojection all need to place reassembled frames on
 * the globe using the navigation parameters broadcast with each frame.</p>
 * <p><strong>Role:</strong> Domain value object attached to frames and consumed by exporters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map geodetic latitude/longitude to scan angles and then to pixels (CGMS normalized
 *       geostationary projection).</li>
 *   <li>Intersect a pixel's line of sight with the reference ellipsoid to recover latitude/longitude.</li>
 *   <li>Expose the visible-disk bounds and trim margins used when reprojecting.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; share freely across threads.</p>
 * <p><strong>Performance:</strong> A handful of trigonometric calls per conversion; no allocation beyond
 * the returned value.</p>
 *
 * @implNote Scale factors are expressed in pixels per radian of scan angle, so
 * {@code pixel = offset + angle * scaleFactor}.
 * @since 0.1.0
 */
public final class GeoReference {
  /** Equatorial radius of the reference ellipsoid in km. */
  static final double EQUATORIAL_RADIUS_KM = 6378.1690;
  /** Polar radius of the reference ellipsoid in km. */
  static final double POLAR_RADIUS_KM = 6356.5838;
  /** Distance between the satellite and the earth centre in km. */
  static final double SATELLITE_DISTANCE_KM = 42164.0;

  private static final double POLAR_TO_EQUATORIAL_SQ =
      (POLAR_RADIUS_KM * POLAR_RADIUS_KM) / (EQUATORIAL_RADIUS_KM * EQUATORIAL_RADIUS_KM);
  private static final double EQUATORIAL_TO_POLAR_SQ = 1.0 / POLAR_TO_EQUATORIAL_SQ;
  private static final double ECCENTRICITY_SQ = 1.0 - POLAR_TO_EQUATORIAL_SQ;
  private static final double VISIBILITY_CONSTANT =
      SATELLITE_DISTANCE_KM * SATELLITE_DISTANCE_KM - EQUATORIAL_RADIUS_KM * EQUATORIAL_RADIUS_KM;

  private static final double DISK_BOUND_DEG = 79.0;
  private static final double TRIM_DEG = 16.0;

  private final double satelliteLongitudeDeg;
  private final int columnOffsetPx;
  private final int lineOffsetPx;
  private final double columnScaleFactor;
  private final double lineScaleFactor;
  private final boolean fixAspect;
  private final int imageWidthPx;
  private final double aspectRatio;
  private final int cropLeftPx;
  private final double subLongitudeRad;

  /**
   * Creates a geo reference without aspect correction and without a known image width.
   *
   * @param satelliteLongitudeDeg sub-satellite longitude in degrees
   * @param columnOffsetPx column offset (COFF)
   * @param lineOffsetPx line offset (LOFF)
   * @param columnScaleFactor column scale factor (CFAC) in pixels per radian
   * @param lineScaleFactor line scale factor (LFAC) in pixels per radian
   */
  public GeoReference(
      double satelliteLongitudeDeg,
      int columnOffsetPx,
      int lineOffsetPx,
      double columnScaleFactor,
      double lineScaleFactor) {
    this(satelliteLongitudeDeg, columnOffsetPx, lineOffsetPx, columnScaleFactor, lineScaleFactor, false, 0);
  }

  /**
   * Creates a geo reference.
   *
   * @param satelliteLongitudeDeg sub-satellite longitude in degrees
   * @param columnOffsetPx column offset (COFF)
   * @param lineOffsetPx line offset (LOFF)
   * @param columnScaleFactor column scale factor (CFAC) in pixels per radian; non-zero
   * @param lineScaleFactor line scale factor (LFAC) in pixels per radian; non-zero
   * @param fixAspect whether to stretch lines by {@code CFAC / LFAC} to compensate a non-square grid
   * @param imageWidthPx image width in pixels, used only to derive {@link #cropLeftPx()}
   * @throws IllegalArgumentException if a scale factor is zero or any value is not finite
   */
  public GeoReference(
      double satelliteLongitudeDeg,
      int columnOffsetPx,
      int lineOffsetPx,
      double columnScaleFactor,
      double lineScaleFactor,
      boolean fixAspect,
      int imageWidthPx) {
    this.satelliteLongitudeDeg = requireFinite("satelliteLongitudeDeg", satelliteLongitudeDeg);
    this.columnOffsetPx = columnOffsetPx;
    this.lineOffsetPx = lineOffsetPx;
    this.columnScaleFactor = requireNonZero("columnScaleFactor", columnScaleFactor);
    this.lineScaleFactor = requireNonZero("lineScaleFactor", lineScaleFactor);
    this.fixAspect = fixAspect;
    this.imageWidthPx = imageWidthPx;
    this.aspectRatio = columnScaleFactor / lineScaleFactor;
    this.cropLeftPx = imageWidthPx <= 0
        ? 0
        : columnOffsetPx - Math.min(imageWidthPx - columnOffsetPx, columnOffsetPx);
    this.subLongitudeRad = Math.toRadians(satelliteLongitudeDeg);
  }

  /**
   * Converts a geodetic coordinate to the nearest pixel.
   *
   * @param latDeg latitude in degrees
   * @param lonDeg longitude in degrees
   * @return pixel coordinate; points behind the limb still yield a (meaningless) pixel, callers should
   *     check {@link #isWithinVisibleDisk(double, double)} first when that matters
   */
  public PixelCoordinate pixelFromGeodetic(double latDeg, double lonDeg) {
    return pixelPositionFromGeodetic(latDeg, lonDeg).rounded();
  }

  /**
   * Converts a geodetic coordinate to a fractional pixel position.
   *
   * @param latDeg latitude in degrees
   * @param lonDeg longitude in degrees
   * @return pixel position
   */
  public PixelPosition pixelPositionFromGeodetic(double latDeg, double lonDeg) {
    double lat = Math.toRadians(latDeg);
    double lon = Math.toRadians(lonDeg);

    double geocentricLat = Math.atan(POLAR_TO_EQUATORIAL_SQ * Math.tan(lat));
    double cosLat = Math.cos(geocentricLat);
    double surfaceRadius = POLAR_RADIUS_KM / Math.sqrt(1.0 - ECCENTRICITY_SQ * cosLat * cosLat);

    double deltaLon = lon - subLongitudeRad;
    double r1 = SATELLITE_DISTANCE_KM - surfaceRadius * cosLat * Math.cos(deltaLon);
    double r2 = -surfaceRadius * cosLat * Math.sin(deltaLon);
    double r3 = surfaceRadius * Math.sin(geocentricLat);
    double rn = Math.sqrt(r1 * r1 + r2 * r2 + r3 * r3);

    double scanX = Math.atan(-r2 / r1);
    double scanY = Math.asin(-r3 / rn);

    double x = columnOffsetPx + scanX * columnScaleFactor;
    double y = lineOffsetPx + scanY * lineScaleFactor;
    if (fixAspect) {
      y *= aspectRatio;
    }
    return new PixelPosition(x, y);
  }

  /**
   * Converts a pixel to its geodetic coordinate.
   *
   * @param x column
   * @param y line
   * @return geodetic coordinate, or empty when the pixel looks past the earth's limb
   */
  public Optional<GeodeticCoordinate> geodeticFromPixel(int x, int y) {
    return geodeticFromPixelPosition(x, y);
  }

  /**
   * Converts a fractional pixel position to its geodetic coordinate.
   *
   * @param x fractional column
   * @param y fractional line
   * @return geodetic coordinate, or empty when the line of sight misses the ellipsoid
   */
  public Optional<GeodeticCoordinate> geodeticFromPixelPosition(double x, double y) {
    double line = fixAspect ? y / aspectRatio : y;
    double scanX = (x - columnOffsetPx) / columnScaleFactor;
    double scanY = (line - lineOffsetPx) / lineScaleFactor;

    double cosX = Math.cos(scanX);
    double cosY = Math.cos(scanY);
    double sinY = Math.sin(scanY);
    double along = SATELLITE_DISTANCE_KM * cosX * cosY;
    double denominator = cosY * cosY + EQUATORIAL_TO_POLAR_SQ * sinY * sinY;

    double discriminant = along * along - denominator * VISIBILITY_CONSTANT;
    if (discriminant < 0) {
      return Optional.empty();
    }

    double slant = (along - Math.sqrt(discriminant)) / denominator;
    double s1 = SATELLITE_DISTANCE_KM - slant * cosX * cosY;
    double s2 = slant * Math.sin(scanX) * cosY;
    double s3 = -slant * sinY;
    double sxy = Math.sqrt(s1 * s1 + s2 * s2);

    double lon = Math.atan2(s2, s1) + subLongitudeRad;
    double lat = Math.atan(EQUATORIAL_TO_POLAR_SQ * s3 / sxy);
    return Optional.of(new GeodeticCoordinate(Math.toDegrees(lat), normalizeLongitude(Math.toDegrees(lon))));
  }

  /**
   * Tests whether a coordinate lies strictly inside the visible-disk bounds.
   *
   * @param latDeg latitude in degrees
   * @param lonDeg longitude in degrees
   * @return {@code true} when inside the latitude and longitude bounds
   */
  public boolean isWithinVisibleDisk(double latDeg, double lonDeg) {
    double deltaLon = normalizeLongitude(lonDeg - satelliteLongitudeDeg);
    return latDeg > minLatitude() && latDeg < maxLatitude() && Math.abs(deltaLon) < DISK_BOUND_DEG;
  }

  public double satelliteLongitudeDeg() {
    return satelliteLongitudeDeg;
  }

  public int columnOffsetPx() {
    return columnOffsetPx;
  }

  public int lineOffsetPx() {
    return lineOffsetPx;
  }

  public double columnScaleFactor() {
    return columnScaleFactor;
  }

  public double lineScaleFactor() {
    return lineScaleFactor;
  }

  public boolean fixAspect() {
    return fixAspect;
  }

  public int imageWidthPx() {
    return imageWidthPx;
  }

  /**
   * Returns the number of columns to drop on the left so the disk is centred horizontally.
   *
   * @return crop offset in pixels; zero when the image width is unknown
   */
  public int cropLeftPx() {
    return cropLeftPx;
  }

  public double minLatitude() {
    return -DISK_BOUND_DEG;
  }

  public double maxLatitude() {
    return DISK_BOUND_DEG;
  }

  public double minLongitude() {
    return satelliteLongitudeDeg - DISK_BOUND_DEG;
  }

  public double maxLongitude() {
    return satelliteLongitudeDeg + DISK_BOUND_DEG;
  }

  public double latitudeCoverage() {
    return maxLatitude() - minLatitude();
  }

  public double longitudeCoverage() {
    return maxLongitude() - minLongitude();
  }

  /** Latitude margin trimmed on reprojection to hide limb artifacts, in degrees. */
  public double trimLatitude() {
    return TRIM_DEG;
  }

  /** Longitude margin trimmed on reprojection to hide limb artifacts, in degrees. */
  public double trimLongitude() {
    return TRIM_DEG;
  }

  private static double normalizeLongitude(double lonDeg) {
    double wrapped = lonDeg % 360.0;
    if (wrapped > 180.0) {
      wrapped -= 360.0;
    } else if (wrapped < -180.0) {
      wrapped += 360.0;
    }
    return wrapped;
  }

  private static double requireFinite(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(name + " must be finite (was " + value + ")");
    }
    return value;
  }

  private static double requireNonZero(String name, double value) {
    requireFinite(name, value);
    if (value == 0.0) {
      throw new IllegalArgumentException(name + " must not be zero");
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GeoReference other)) {
      return false;
    }
    return Double.compare(satelliteLongitudeDeg, other.satelliteLongitudeDeg) == 0
        && columnOffsetPx == other.columnOffsetPx
        && lineOffsetPx == other.lineOffsetPx
        && Double.compare(columnScaleFactor, other.columnScaleFactor) == 0
        && Double.compare(lineScaleFactor, other.lineScaleFactor) == 0
        && fixAspect == other.fixAspect
        && imageWidthPx == other.imageWidthPx;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        satelliteLongitudeDeg,
        columnOffsetPx,
        lineOffsetPx,
        columnScaleFactor,
        lineScaleFactor,
        fixAspect,
        imageWidthPx);
  }

  @Override
  public String toString() {
    return "GeoReference{"
        + "satelliteLongitudeDeg=" + satelliteLongitudeDeg
        + ", coff=" + columnOffsetPx
        + ", loff=" + lineOffsetPx
        + ", cfac=" + columnScaleFactor
        + ", lfac=" + lineScaleFactor
        + ", fixAspect=" + fixAspect
        + ", imageWidthPx=" + imageWidthPx
        + '}';
  }
}

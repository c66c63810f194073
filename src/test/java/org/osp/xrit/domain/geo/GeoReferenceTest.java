package org.osp.xrit.domain.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class GeoReferenceTest {
  private static final double TOLERANCE_DEG = 0.01;

  // 3 km sampling at nadir: 1 / (3 / 35786) pixels per radian.
  private static final GeoReference GOES_EAST = new GeoReference(-75.2, 1856, 1856, 11927, 11927);

  @Test
  void subSatellitePointMapsToTheOffsets() {
    GeoReference reference = new GeoReference(140.7, 1375, 1375, 8946, 8946);

    assertEquals(new PixelCoordinate(1375, 1375), reference.pixelFromGeodetic(0.0, 140.7));
    GeodeticCoordinate centre = reference.geodeticFromPixel(1375, 1375).orElseThrow();
    assertEquals(0.0, centre.latitudeDeg(), 1e-9);
    assertEquals(140.7, centre.longitudeDeg(), 1e-9);
  }

  @Test
  void fractionalRoundTripRecoversTheCoordinate() {
    PixelPosition position = GOES_EAST.pixelPositionFromGeodetic(10.0, -70.0);

    GeodeticCoordinate back = GOES_EAST.geodeticFromPixelPosition(position.x(), position.y()).orElseThrow();

    assertEquals(10.0, back.latitudeDeg(), TOLERANCE_DEG);
    assertEquals(-70.0, back.longitudeDeg(), TOLERANCE_DEG);
  }

  @Test
  void integerRoundTripIsAccurateAtFineSampling() {
    GeoReference fine = new GeoReference(-75.2, 1856, 1856, 400_000, 400_000);

    PixelCoordinate pixel = fine.pixelFromGeodetic(10.0, -70.0);
    GeodeticCoordinate back = fine.geodeticFromPixel(pixel.x(), pixel.y()).orElseThrow();

    assertEquals(10.0, back.latitudeDeg(), TOLERANCE_DEG);
    assertEquals(-70.0, back.longitudeDeg(), TOLERANCE_DEG);
  }

  @Test
  void northIsUpAndEastIsRight() {
    PixelPosition centre = GOES_EAST.pixelPositionFromGeodetic(0.0, -75.2);
    PixelPosition northEast = GOES_EAST.pixelPositionFromGeodetic(20.0, -60.0);

    assertTrue(northEast.x() > centre.x());
    assertTrue(northEast.y() < centre.y());
  }

  @Test
  void pixelOffTheDiskIsOutOfView() {
    assertEquals(Optional.empty(), GOES_EAST.geodeticFromPixel(0, 0));
    assertEquals(Optional.empty(), GOES_EAST.geodeticFromPixel(1856 + (int) (0.2 * 11927), 1856));
  }

  @Test
  void longitudeIsNormalizedAcrossTheAntimeridian() {
    GeoReference himawari = new GeoReference(140.7, 1375, 1375, 8946, 8946);
    PixelPosition position = himawari.pixelPositionFromGeodetic(-20.0, -175.0);

    GeodeticCoordinate back = himawari.geodeticFromPixelPosition(position.x(), position.y()).orElseThrow();

    assertEquals(-20.0, back.latitudeDeg(), TOLERANCE_DEG);
    assertEquals(-175.0, back.longitudeDeg(), TOLERANCE_DEG);
  }

  @Test
  void aspectCorrectionStretchesLinesAndInvertsCleanly() {
    GeoReference stretched = new GeoReference(0.0, 1856, 928, 11927, 5963.5, true, 3712);
    GeoReference plain = new GeoReference(0.0, 1856, 928, 11927, 5963.5, false, 3712);

    PixelPosition corrected = stretched.pixelPositionFromGeodetic(30.0, 10.0);
    PixelPosition raw = plain.pixelPositionFromGeodetic(30.0, 10.0);
    assertEquals(raw.x(), corrected.x(), 1e-9);
    assertEquals(raw.y() * 2.0, corrected.y(), 1e-9);

    GeodeticCoordinate back = stretched.geodeticFromPixelPosition(corrected.x(), corrected.y()).orElseThrow();
    assertEquals(30.0, back.latitudeDeg(), TOLERANCE_DEG);
    assertEquals(10.0, back.longitudeDeg(), TOLERANCE_DEG);
  }

  @Test
  void aspectCorrectionScalesTheSubSatelliteLine() {
    GeoReference stretched = new GeoReference(0.0, 1856, 928, 11927, 5963.5, true, 3712);

    // LOFF * CFAC / LFAC
    assertEquals(new PixelCoordinate(1856, 1856), stretched.pixelFromGeodetic(0.0, 0.0));
    GeodeticCoordinate centre = stretched.geodeticFromPixel(1856, 1856).orElseThrow();
    assertEquals(0.0, centre.latitudeDeg(), 1e-9);
    assertEquals(0.0, centre.longitudeDeg(), 1e-9);
  }

  @Test
  void cropLeftCentresTheDisk() {
    GeoReference reference = new GeoReference(0.0, 1924, 1856, 11927, 11927, false, 3000);

    assertEquals(848, reference.cropLeftPx());
    assertEquals(0, new GeoReference(0.0, 1856, 1856, 11927, 11927, false, 3712).cropLeftPx());
    assertEquals(0, GOES_EAST.cropLeftPx());
  }

  @Test
  void visibleDiskBoundsFollowTheSatellite() {
    assertEquals(-79.0, GOES_EAST.minLatitude());
    assertEquals(79.0, GOES_EAST.maxLatitude());
    assertEquals(-154.2, GOES_EAST.minLongitude(), 1e-9);
    assertEquals(3.8, GOES_EAST.maxLongitude(), 1e-9);
    assertEquals(158.0, GOES_EAST.latitudeCoverage(), 1e-9);
    assertEquals(158.0, GOES_EAST.longitudeCoverage(), 1e-9);
    assertEquals(16.0, GOES_EAST.trimLatitude());
    assertEquals(16.0, GOES_EAST.trimLongitude());

    assertTrue(GOES_EAST.isWithinVisibleDisk(10.0, -70.0));
    assertFalse(GOES_EAST.isWithinVisibleDisk(80.0, -75.2));
    assertFalse(GOES_EAST.isWithinVisibleDisk(0.0, 30.0));
  }

  @Test
  void rejectsDegenerateParameters() {
    assertThrows(IllegalArgumentException.class, () -> new GeoReference(0.0, 0, 0, 0.0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new GeoReference(0.0, 0, 0, 1.0, 0.0));
    assertThrows(IllegalArgumentException.class, () -> new GeoReference(Double.NaN, 0, 0, 1.0, 1.0));
  }

  @Test
  void equalityCoversEveryParameter() {
    assertEquals(new GeoReference(-75.2, 1856, 1856, 11927, 11927), GOES_EAST);
    assertEquals(GOES_EAST.hashCode(), new GeoReference(-75.2, 1856, 1856, 11927, 11927).hashCode());
    assertNotEquals(new GeoReference(-75.2, 1856, 1856, 11927, 11927, true, 0), GOES_EAST);
  }
}

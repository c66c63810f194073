package org.osp.xrit.infrastructure.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.osp.xrit.domain.frame.FrameKey;
import org.osp.xrit.domain.geo.GeoReference;

class StaticGeoReferenceCatalogTest {
  private static final Instant TIME = Instant.parse("2024-05-01T12:00:00Z");
  private static final GeoReference FULL_DISK = new GeoReference(0.0, 1856, 1856, 11927, 11927);
  private static final GeoReference RAPID_SCAN = new GeoReference(9.5, 1856, 464, 11927, 11927);

  private final StaticGeoReferenceCatalog catalog = new StaticGeoReferenceCatalog(Map.of(
      "MSG4", FULL_DISK,
      "msg4/RSS", RAPID_SCAN));

  @Test
  void resolvesBySatelliteIgnoringCase() {
    assertEquals(Optional.of(FULL_DISK), catalog.resolve(new FrameKey("Msg4", "FD", TIME)));
  }

  @Test
  void regionSpecificEntryWins() {
    assertEquals(Optional.of(RAPID_SCAN), catalog.resolve(new FrameKey("MSG4", "rss", TIME)));
  }

  @Test
  void unknownSatelliteResolvesEmpty() {
    assertTrue(catalog.resolve(new FrameKey("GOES-16", "FD", TIME)).isEmpty());
    assertEquals(2, catalog.size());
  }
}

package org.osp.xrit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.osp.xrit.domain.geo.GeoReference;

class ReassemblyConfigTest {

  @TempDir
  Path tempDir;

  @Test
  void defaultsMatchRegistryDefaults() {
    ReassemblyConfig config = ReassemblyConfig.fromMap(Map.of());

    assertEquals(Duration.ofHours(2), config.timeout());
    assertEquals(1, config.maxRetries());
    assertEquals(Duration.ofSeconds(5), config.sweepInterval());
    assertEquals("none", config.metricsExporter());
    assertFalse(config.metricsEnabled());
    assertTrue(config.geoReferences().isEmpty());
    assertEquals(config.timeout(), config.registrySettings().timeout());
  }

  @Test
  void parsesScalarsAndGeoEntries() {
    ReassemblyConfig config = ReassemblyConfig.fromMap(Map.of(
        "timeoutSeconds", "900",
        "maxRetries", "3",
        "sweepIntervalSeconds", "2",
        "metricsExporter", "OTLP",
        "geo.GOES-16.longitude", "-75.2",
        "geo.GOES-16.coff", "1356",
        "geo.GOES-16.loff", "1356",
        "geo.GOES-16.cfac", "11927",
        "geo.GOES-16.lfac", "11927",
        "geo.GOES-16.imageWidth", "2712"));

    assertEquals(Duration.ofMinutes(15), config.timeout());
    assertEquals(3, config.maxRetries());
    assertEquals(Duration.ofSeconds(2), config.sweepInterval());
    assertEquals("otlp", config.metricsExporter());
    assertTrue(config.metricsEnabled());
    assertEquals(
        new GeoReference(-75.2, 1356, 1356, 11927, 11927, false, 2712),
        config.geoReferences().get("GOES-16"));
  }

  @Test
  void satelliteNamesMayContainDots() {
    Map<String, GeoReference> references = ReassemblyConfig.parseGeoReferences(Map.of(
        "geo.FY-4.B.longitude", "133.0",
        "geo.FY-4.B.coff", "1374",
        "geo.FY-4.B.loff", "1374",
        "geo.FY-4.B.cfac", "8946",
        "geo.FY-4.B.lfac", "8946",
        "geo.FY-4.B.fixAspect", "true"));

    assertTrue(references.get("FY-4.B").fixAspect());
  }

  @Test
  void regionSpecificEntriesUseSatelliteSlashRegion() {
    Map<String, GeoReference> references = ReassemblyConfig.parseGeoReferences(Map.of(
        "geo.MSG4/RSS.longitude", "9.5",
        "geo.MSG4/RSS.coff", "1856",
        "geo.MSG4/RSS.loff", "464",
        "geo.MSG4/RSS.cfac", "11927",
        "geo.MSG4/RSS.lfac", "11927"));

    assertEquals(464, references.get("MSG4/RSS").lineOffsetPx());
    assertThrows(IllegalArgumentException.class, () -> ReassemblyConfig.parseGeoReferences(Map.of(
        "geo.MSG 4.longitude", "0.0")));
  }

  @Test
  void incompleteGeoEntryIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
        ReassemblyConfig.fromMap(Map.of("geo.MSG4.longitude", "0.0")));

    assertTrue(ex.getMessage().contains("geo.MSG4.coff"));
  }

  @Test
  void offsetsBeyondIntRangeAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
        ReassemblyConfig.fromMap(Map.of(
            "geo.MSG4.longitude", "0.0",
            "geo.MSG4.coff", "4294969152",
            "geo.MSG4.loff", "1856",
            "geo.MSG4.cfac", "11927",
            "geo.MSG4.lfac", "11927")));

    assertTrue(ex.getMessage().contains("geo.MSG4.coff must be between"));
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> ReassemblyConfig.fromMap(Map.of("timeoutSeconds", "0")));
    assertThrows(IllegalArgumentException.class, () -> ReassemblyConfig.fromMap(Map.of("maxRetries", "-1")));
    assertThrows(IllegalArgumentException.class, () -> ReassemblyConfig.fromMap(Map.of("timeoutSeconds", "soon")));
    assertThrows(IllegalArgumentException.class,
        () -> ReassemblyConfig.fromMap(Map.of("metricsExporter", "prometheus")));
  }

  @Test
  void loadsReassemblySectionFromYaml() throws IOException {
    Path file = tempDir.resolve("xrit.yaml");
    Files.writeString(file, """
        common:
          sweepIntervalSeconds: 10
        reassembly:
          timeoutSeconds: 3600
          geo:
            MSG4:
              longitude: 0.0
              coff: 1856
              loff: 1856
              cfac: 11927
              lfac: 11927
        """);

    ReassemblyConfig config = ReassemblyConfig.load(file);

    assertEquals(Duration.ofHours(1), config.timeout());
    assertEquals(Duration.ofSeconds(10), config.sweepInterval());
    assertEquals(1856, config.geoReferences().get("MSG4").columnOffsetPx());
  }

  @Test
  void missingYamlFallsBackToDefaults() throws IOException {
    assertEquals(ReassemblyConfig.defaults(), ReassemblyConfig.load(tempDir.resolve("none.yaml")));
  }
}

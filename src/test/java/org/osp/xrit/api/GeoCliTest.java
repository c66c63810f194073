package org.osp.xrit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GeoCliTest {
  private static final String[] GOES_EAST = {
      "satLon=-75.2", "coff=1856", "loff=1856", "cfac=11927", "lfac=11927"};

  @TempDir
  Path tempDir;

  private StringWriter output;

  @BeforeEach
  void setUp() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void convertsLatitudeLongitudeToPixel() {
    ExitCode exit = GeoCli.run(with(GOES_EAST, "lat=10", "lon=-70"));

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals("x=2045 y=1491 (2045.095, 1490.728)", output.toString().trim());
  }

  @Test
  void convertsPixelToLatitudeLongitude() {
    ExitCode exit = GeoCli.run(with(GOES_EAST, "x=2045.0951405669146", "y=1490.7280686994213"));

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals("lat=10.000000 lon=-70.000000", output.toString().trim());
  }

  @Test
  void subSatellitePixelPrintsUnsignedZeroLatitude() {
    GeoCli.run(with(GOES_EAST, "x=1856", "y=1856"));

    assertEquals("lat=0.000000 lon=-75.200000", output.toString().trim());
  }

  @Test
  void reportsOutOfViewBothWays() {
    assertEquals(ExitCode.SUCCESS, GeoCli.run(with(GOES_EAST, "x=0", "y=0")));
    assertEquals(ExitCode.SUCCESS, GeoCli.run(with(GOES_EAST, "lat=0", "lon=60")));

    assertEquals("out of view" + System.lineSeparator() + "out of view", output.toString().trim());
  }

  @Test
  void readsGeometryFromConfiguration() throws IOException {
    Path config = tempDir.resolve("xrit.yaml");
    Files.writeString(config, """
        reassembly:
          geo:
            GOES-16:
              longitude: -75.2
              coff: 1856
              loff: 1856
              cfac: 11927
              lfac: 11927
        """);

    ExitCode exit = GeoCli.run(new String[] {"config=" + config, "satellite=goes-16", "lat=10", "lon=-70"});

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(output.toString().startsWith("x=2045 y=1491"));
  }

  @Test
  void unknownSatelliteIsAConfigError() throws IOException {
    Path config = tempDir.resolve("xrit.yaml");
    Files.writeString(config, "reassembly:\n  timeoutSeconds: 60\n");

    assertEquals(ExitCode.CONFIG_ERROR,
        GeoCli.run(new String[] {"config=" + config, "satellite=MSG4", "x=1", "y=1"}));
  }

  @Test
  void missingConfigFileIsAnIoError() {
    assertEquals(ExitCode.IO_ERROR, GeoCli.run(
        new String[] {"config=" + tempDir.resolve("missing.yaml"), "satellite=MSG4", "x=1", "y=1"}));
  }

  @Test
  void incompleteArgumentsAreRejected() {
    assertEquals(ExitCode.INVALID_ARGS, GeoCli.run(GOES_EAST));
    assertEquals(ExitCode.INVALID_ARGS, GeoCli.run(new String[] {"coff=1856", "lat=0", "lon=0"}));
    assertEquals(ExitCode.INVALID_ARGS, GeoCli.run(with(GOES_EAST, "lat=north", "lon=0")));
    assertEquals(ExitCode.INVALID_ARGS, GeoCli.run(new String[] {"satLon"}));
    assertEquals(ExitCode.INVALID_ARGS, GeoCli.run(new String[] {
        "satLon=-75.2", "coff=1856", "loff=4294969152", "cfac=11927", "lfac=11927", "lat=0", "lon=0"}));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, GeoCli.run(new String[] {"--help"}));

    assertTrue(output.toString().startsWith("usage: xrit geo"));
  }

  private static String[] with(String[] base, String... extra) {
    String[] args = new String[base.length + extra.length];
    System.arraycopy(base, 0, args, 0, base.length);
    System.arraycopy(extra, 0, args, base.length, extra.length);
    return args;
  }
}

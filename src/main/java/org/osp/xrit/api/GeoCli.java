package org.osp.xrit.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.osp.xrit.config.ReassemblyConfig;
import org.osp.xrit.domain.geo.GeoReference;
import org.osp.xrit.domain.geo.GeodeticCoordinate;
import org.osp.xrit.domain.geo.PixelPosition;
import org.osp.xrit.logging.LoggingConfigurator;
import org.osp.xrit.validation.Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts one coordinate between a satellite's pixel grid and latitude/longitude.
 * <p>The geometry comes either from explicit {@code satLon/coff/loff/cfac/lfac} arguments or from the
 * {@code geo} table of a YAML configuration file.</p>
 */
public final class GeoCli {
  private static final Logger log = LoggerFactory.getLogger(GeoCli.class);
  private static final String OUT_OF_VIEW = "out of view";
  private static final String USAGE = """
      usage: xrit geo satLon=DEG coff=PX loff=PX cfac=F lfac=F [fixAspect=true] [imageWidth=PX] \
      (lat=DEG lon=DEG | x=PX y=PX)
             xrit geo config=PATH satellite=NAME (lat=DEG lon=DEG | x=PX y=PX)""";

  private GeoCli() {}

  /**
   * Runs the conversion and prints the result.
   *
   * @param args {@code key=value} arguments
   * @return exit code
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(USAGE);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> options;
    try {
      options = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid geo arguments: {}", ex.getMessage());
      CliPrinter.println(USAGE);
      return ExitCode.INVALID_ARGS;
    }

    GeoReference reference;
    if (options.containsKey("config")) {
      try {
        Optional<GeoReference> configured = fromConfig(options);
        if (configured.isEmpty()) {
          log.error("No geo entry for satellite {} in {}", options.get("satellite"), options.get("config"));
          return ExitCode.CONFIG_ERROR;
        }
        reference = configured.get();
      } catch (IOException ex) {
        log.error("Unable to read config {}", options.get("config"), ex);
        return ExitCode.IO_ERROR;
      } catch (IllegalArgumentException ex) {
        log.error("Invalid geo configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
    } else {
      try {
        reference = fromArguments(options);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid geo arguments: {}", ex.getMessage());
        CliPrinter.println(USAGE);
        return ExitCode.INVALID_ARGS;
      }
    }
    log.debug("Using {}", reference);

    try {
      if (options.containsKey("lat") && options.containsKey("lon")) {
        double lat = Numbers.parseFiniteDouble("lat", options.get("lat"));
        double lon = Numbers.parseFiniteDouble("lon", options.get("lon"));
        CliPrinter.println(toPixel(reference, lat, lon));
        return ExitCode.SUCCESS;
      }
      if (options.containsKey("x") && options.containsKey("y")) {
        double x = Numbers.parseFiniteDouble("x", options.get("x"));
        double y = Numbers.parseFiniteDouble("y", options.get("y"));
        CliPrinter.println(toGeodetic(reference, x, y));
        return ExitCode.SUCCESS;
      }
      log.error("Either lat/lon or x/y is required");
    } catch (IllegalArgumentException ex) {
      log.error("Invalid coordinate: {}", ex.getMessage());
    }
    CliPrinter.println(USAGE);
    return ExitCode.INVALID_ARGS;
  }

  static String toPixel(GeoReference reference, double lat, double lon) {
    if (!reference.isWithinVisibleDisk(lat, lon)) {
      return OUT_OF_VIEW;
    }
    PixelPosition position = reference.pixelPositionFromGeodetic(lat, lon);
    return String.format(Locale.ROOT, "x=%d y=%d (%.3f, %.3f)",
        position.rounded().x(), position.rounded().y(), position.x(), position.y());
  }

  static String toGeodetic(GeoReference reference, double x, double y) {
    Optional<GeodeticCoordinate> coordinate = reference.geodeticFromPixelPosition(x, y);
    return coordinate
        // Adding 0.0 turns -0.0 into 0.0 so the sub-satellite point prints without a sign.
        .map(c -> String.format(Locale.ROOT, "lat=%.6f lon=%.6f", c.latitudeDeg() + 0.0, c.longitudeDeg() + 0.0))
        .orElse(OUT_OF_VIEW);
  }

  private static Optional<GeoReference> fromConfig(Map<String, String> options) throws IOException {
    String satellite = options.get("satellite");
    if (satellite == null) {
      throw new IllegalArgumentException("satellite is required with config");
    }
    Path path;
    try {
      path = Path.of(options.get("config"));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config is not a valid path: " + ex.getMessage(), ex);
    }
    if (!Files.isRegularFile(path)) {
      throw new IOException("config file not found: " + path);
    }
    Map<String, GeoReference> references = ReassemblyConfig.load(path).geoReferences();
    return references.entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(satellite))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  private static GeoReference fromArguments(Map<String, String> options) {
    double satLon = Numbers.parseFiniteDouble("satLon", required(options, "satLon"));
    int coff = Numbers.parseInt("coff", required(options, "coff"));
    int loff = Numbers.parseInt("loff", required(options, "loff"));
    double cfac = Numbers.parseFiniteDouble("cfac", required(options, "cfac"));
    double lfac = Numbers.parseFiniteDouble("lfac", required(options, "lfac"));
    boolean fixAspect = Boolean.parseBoolean(options.getOrDefault("fixAspect", "false"));
    int width = options.containsKey("imageWidth")
        ? (int) Numbers.requireRange("imageWidth", Numbers.parseLong("imageWidth", options.get("imageWidth")),
            0, Integer.MAX_VALUE)
        : 0;
    return new GeoReference(satLon, coff, loff, cfac, lfac, fixAspect, width);
  }

  private static String required(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }
}

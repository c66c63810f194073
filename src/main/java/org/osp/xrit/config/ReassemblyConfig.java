package org.osp.xrit.config;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.osp.xrit.application.reassembly.RegistrySettings;
import org.osp.xrit.domain.frame.FrameGroup;
import org.osp.xrit.domain.geo.GeoReference;
import org.osp.xrit.validation.Numbers;
import org.osp.xrit.validation.Strings;

/**
 * <strong>What:</strong> Settings for a reassembly session.
 * <p><strong>Why:</strong> Consolidates YAML and CLI key/value input so sessions are reproducible across
 * ground stations.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param timeout accumulation window per attempt
 * @param maxRetries extra windows granted to a timed-out frame holding partial data
 * @param sweepInterval delay between timeout sweeps
 * @param metricsExporter {@code otlp} or {@code none}
 * @param geoReferences scan geometry per satellite (or {@code satellite/region})
 * @since 0.1.0
 */
public record ReassemblyConfig(
    Duration timeout,
    int maxRetries,
    Duration sweepInterval,
    String metricsExporter,
    Map<String, GeoReference> geoReferences) {

  static final long MAX_TIMEOUT_SECONDS = Duration.ofDays(7).toSeconds();
  static final int MAX_RETRIES = 100;
  static final long MAX_SWEEP_SECONDS = Duration.ofHours(1).toSeconds();
  private static final String GEO_PREFIX = "geo.";

  public ReassemblyConfig {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(sweepInterval, "sweepInterval");
    Numbers.requireRange("timeoutSeconds", timeout.toSeconds(), 1, MAX_TIMEOUT_SECONDS);
    Numbers.requireRange("maxRetries", maxRetries, 0, MAX_RETRIES);
    Numbers.requireRange("sweepIntervalSeconds", sweepInterval.toSeconds(), 1, MAX_SWEEP_SECONDS);
    metricsExporter = normalizeExporter(metricsExporter);
    geoReferences = Map.copyOf(Objects.requireNonNull(geoReferences, "geoReferences"));
  }

  /**
   * Two-hour timeout, one retry, five-second sweep, no metrics export, no geometry.
   *
   * @return default configuration
   */
  public static ReassemblyConfig defaults() {
    return new ReassemblyConfig(
        FrameGroup.DEFAULT_TIMEOUT, RegistrySettings.DEFAULT_MAX_RETRIES, Duration.ofSeconds(5), "none", Map.of());
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param options keys such as {@code timeoutSeconds} or {@code geo.MSG4.cfac}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is malformed or a geo entry is incomplete
   */
  public static ReassemblyConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ReassemblyConfig defaults = defaults();

    Duration timeout = optional(options, "timeoutSeconds")
        .map(raw -> Duration.ofSeconds(Numbers.parseLong("timeoutSeconds", raw)))
        .orElse(defaults.timeout());
    int maxRetries = optional(options, "maxRetries")
        .map(raw -> (int) Numbers.requireRange("maxRetries", Numbers.parseLong("maxRetries", raw), 0, MAX_RETRIES))
        .orElse(defaults.maxRetries());
    Duration sweepInterval = optional(options, "sweepIntervalSeconds")
        .map(raw -> Duration.ofSeconds(Numbers.parseLong("sweepIntervalSeconds", raw)))
        .orElse(defaults.sweepInterval());
    String exporter = optional(options, "metricsExporter").orElse(defaults.metricsExporter());

    return new ReassemblyConfig(timeout, maxRetries, sweepInterval, exporter, parseGeoReferences(options));
  }

  /**
   * Loads the {@code reassembly} section (over {@code common}) of a YAML file.
   *
   * @param path YAML file
   * @return parsed configuration; defaults when the file does not exist
   * @throws IOException when the file cannot be read
   */
  public static ReassemblyConfig load(Path path) throws IOException {
    return fromMap(YamlConfigLoader.load(path, "reassembly").orElse(Map.of()));
  }

  public RegistrySettings registrySettings() {
    return new RegistrySettings(timeout, maxRetries);
  }

  public boolean metricsEnabled() {
    return !"none".equals(metricsExporter);
  }

  static Map<String, GeoReference> parseGeoReferences(Map<String, String> options) {
    Map<String, Map<String, String>> bySatellite = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (!key.startsWith(GEO_PREFIX)) {
        continue;
      }
      int split = key.lastIndexOf('.');
      if (split <= GEO_PREFIX.length()) {
        throw new IllegalArgumentException("geo entry must be geo.<satellite>.<field> (was " + key + ")");
      }
      String satellite = Strings.requireNonBlank("geo satellite", key.substring(GEO_PREFIX.length(), split));
      for (String part : satellite.split("/", -1)) {
        Strings.requireIdentifier(key, part);
      }
      bySatellite.computeIfAbsent(satellite, s -> new LinkedHashMap<>())
          .put(key.substring(split + 1), entry.getValue());
    }

    Map<String, GeoReference> references = new LinkedHashMap<>();
    bySatellite.forEach((satellite, fields) -> references.put(satellite, toGeoReference(satellite, fields)));
    return references;
  }

  private static GeoReference toGeoReference(String satellite, Map<String, String> fields) {
    String prefix = GEO_PREFIX + satellite + ".";
    double longitude = Numbers.parseFiniteDouble(prefix + "longitude", required(fields, prefix, "longitude"));
    int coff = Numbers.parseInt(prefix + "coff", required(fields, prefix, "coff"));
    int loff = Numbers.parseInt(prefix + "loff", required(fields, prefix, "loff"));
    double cfac = Numbers.parseFiniteDouble(prefix + "cfac", required(fields, prefix, "cfac"));
    double lfac = Numbers.parseFiniteDouble(prefix + "lfac", required(fields, prefix, "lfac"));
    boolean fixAspect = Boolean.parseBoolean(fields.getOrDefault("fixAspect", "false").trim());
    String widthRaw = fields.get("imageWidth");
    int width = widthRaw == null || widthRaw.isBlank()
        ? 0
        : (int) Numbers.requireRange(prefix + "imageWidth", Numbers.parseLong(prefix + "imageWidth", widthRaw),
            0, Integer.MAX_VALUE);
    return new GeoReference(longitude, coff, loff, cfac, lfac, fixAspect, width);
  }

  private static String required(Map<String, String> fields, String prefix, String field) {
    String value = fields.get(field);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(prefix + field + " is required");
    }
    return value;
  }

  private static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  private static String normalizeExporter(String raw) {
    if (raw == null || raw.isBlank()) {
      return "none";
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
    }
    return normalized;
  }
}

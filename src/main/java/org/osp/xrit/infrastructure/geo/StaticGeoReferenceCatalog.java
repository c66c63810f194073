package org.osp.xrit.infrastructure.geo;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.osp.xrit.application.port.GeoReferenceCatalog;
import org.osp.xrit.domain.frame.FrameKey;
import org.osp.xrit.domain.geo.GeoReference;

/**
 * Geo reference catalog backed by a fixed table loaded from configuration.
 * <p>Entries are keyed either by satellite name or by {@code satellite/region}; the region-specific entry
 * wins. Lookups ignore case.</p>
 */
public final class StaticGeoReferenceCatalog implements GeoReferenceCatalog {
  private final Map<String, GeoReference> entries;

  /**
   * Creates a catalog.
   *
   * @param entries geo references keyed by satellite name or {@code satellite/region}
   */
  public StaticGeoReferenceCatalog(Map<String, GeoReference> entries) {
    Objects.requireNonNull(entries, "entries");
    Map<String, GeoReference> normalized = new LinkedHashMap<>();
    entries.forEach((name, reference) ->
        normalized.put(normalize(name), Objects.requireNonNull(reference, "reference for " + name)));
    this.entries = Map.copyOf(normalized);
  }

  @Override
  public Optional<GeoReference> resolve(FrameKey key) {
    Objects.requireNonNull(key, "key");
    GeoReference regional = entries.get(normalize(key.satelliteName() + "/" + key.regionName()));
    if (regional != null) {
      return Optional.of(regional);
    }
    return Optional.ofNullable(entries.get(normalize(key.satelliteName())));
  }

  public int size() {
    return entries.size();
  }

  private static String normalize(String name) {
    return Objects.requireNonNull(name, "name").trim().toLowerCase(Locale.ROOT);
  }
}

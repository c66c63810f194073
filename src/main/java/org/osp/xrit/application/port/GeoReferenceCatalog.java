package org.osp.xrit.application.port;

import java.util.Optional;
import org.osp.xrit.domain.frame.FrameKey;
import org.osp.xrit.domain.geo.GeoReference;

/**
 * <strong>What:</strong> Port resolving the scan geometry for a frame.
 * <p><strong>Why:</strong> Frames whose segments carry no navigation header still need a geo reference
 * when handed to exporters; each satellite/scan geometry has its own immutable instance.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent lookups.</p>
 *
 * @since 0.1.0
 * @see org.osp.xrit.infrastructure.geo.StaticGeoReferenceCatalog
 */
public interface GeoReferenceCatalog {
  /**
   * Resolves the geo reference for a frame.
   *
   * @param key frame identity
   * @return geo reference when the satellite/region is known
   */
  Optional<GeoReference> resolve(FrameKey key);

  /** Catalog that knows no geometry. */
  GeoReferenceCatalog EMPTY = key -> Optional.empty();
}

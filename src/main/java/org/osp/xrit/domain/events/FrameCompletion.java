package org.osp.xrit.domain.events;

import java.util.Objects;
import java.util.Optional;
import org.osp.xrit.domain.frame.FrameGroup;
import org.osp.xrit.domain.frame.FrameKey;
import org.osp.xrit.domain.geo.GeoReference;

/**
 * <strong>What:</strong> Notification that a frame became complete.
 * <p><strong>Why:</strong> Exporters render the frame once every channel has arrived, geo-referenced by
 * the navigation that travelled with it.</p>
 * <p><strong>Thread-safety:</strong> The record is immutable; the referenced group now belongs to the
 * consumer, which must not expect the registry to keep its buffers.</p>
 *
 * @param group completed frame group; never {@code null}
 * @param geoReference navigation for the frame when known
 * @since 0.1.0
 */
public record FrameCompletion(FrameGroup group, Optional<GeoReference> geoReference) {

  public FrameCompletion {
    Objects.requireNonNull(group, "group");
    geoReference = geoReference == null ? Optional.empty() : geoReference;
  }

  public FrameKey key() {
    return group.key();
  }
}

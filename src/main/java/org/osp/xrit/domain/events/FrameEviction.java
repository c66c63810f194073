package org.osp.xrit.domain.events;

import java.util.Objects;
import org.osp.xrit.domain.frame.CompletenessSummary;
import org.osp.xrit.domain.frame.FrameGroup;
import org.osp.xrit.domain.frame.FrameKey;

/**
 * <strong>What:</strong> Notification that an incomplete frame was removed from the registry.
 * <p><strong>Why:</strong> Consumers track lost frames and may still export partial data from
 * {@link #group()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; the group is no longer mutated by the registry.</p>
 *
 * @param key frame identity
 * @param summary per-channel completeness at removal time
 * @param failed whether the frame ended in the failed state
 * @param reason removal cause
 * @param group removed group, handed over with whatever data it holds
 * @since 0.1.0
 */
public record FrameEviction(
    FrameKey key,
    CompletenessSummary summary,
    boolean failed,
    EvictionReason reason,
    FrameGroup group) {

  public FrameEviction {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(group, "group");
  }
}

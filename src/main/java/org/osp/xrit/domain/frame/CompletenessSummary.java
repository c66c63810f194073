package org.osp.xrit.domain.frame;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Snapshot of per-channel completeness for a frame, attached to eviction and retry notifications.
 *
 * @param visible visible channel progress
 * @param infrared infrared channel progress
 * @param waterVapour water vapour channel progress
 * @param others auxiliary channel progress, sorted by channel name
 * @since 0.1.0
 */
public record CompletenessSummary(
    ChannelProgress visible,
    ChannelProgress infrared,
    ChannelProgress waterVapour,
    List<ChannelProgress> others) {

  public CompletenessSummary {
    Objects.requireNonNull(visible, "visible");
    Objects.requireNonNull(infrared, "infrared");
    Objects.requireNonNull(waterVapour, "waterVapour");
    others = List.copyOf(Objects.requireNonNull(others, "others"));
  }

  /**
   * Returns {@code true} when every channel is complete; auxiliary channels are vacuously complete
   * when none exist.
   *
   * @return overall completeness
   */
  public boolean complete() {
    return visible.complete()
        && infrared.complete()
        && waterVapour.complete()
        && others.stream().allMatch(ChannelProgress::complete);
  }

  /**
   * Returns {@code true} when at least one segment was accepted on any channel.
   *
   * @return whether any data arrived
   */
  public boolean hasData() {
    return visible.received() > 0
        || infrared.received() > 0
        || waterVapour.received() > 0
        || others.stream().anyMatch(p -> p.received() > 0);
  }

  /** Total segments accepted across all channels. */
  public int receivedSegments() {
    return visible.received()
        + infrared.received()
        + waterVapour.received()
        + others.stream().mapToInt(ChannelProgress::received).sum();
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "[", "]");
    joiner.add(visible.toString());
    joiner.add(infrared.toString());
    joiner.add(waterVapour.toString());
    others.forEach(p -> joiner.add(p.toString()));
    return joiner.toString();
  }
}

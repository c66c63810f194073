package org.osp.xrit.domain.frame;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Tracks the segments received for one spectral channel of one frame.
 * <p>Not thread-safe on its own; the owning {@link FrameGroup} serializes all access. Mutators are
 * package-private so segments only enter through the group.</p>
 *
 * @since 0.1.0
 */
public final class ChannelAggregator {
  static final int UNKNOWN = -1;

  private final NavigableMap<Integer, byte[]> payloads = new TreeMap<>();
  private int expectedCount = UNKNOWN;

  /**
   * Offers a segment to this channel.
   *
   * @param index zero-based segment index
   * @param total number of segments the channel is declared to have
   * @param payload fragment bytes; copied when accepted
   * @return outcome; rejected segments leave the channel untouched
   */
  SegmentOutcome addSegment(int index, int total, byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    if (expectedCount == UNKNOWN) {
      if (total <= 0) {
        return SegmentOutcome.INVALID_TOTAL;
      }
      expectedCount = total;
    } else if (total != expectedCount) {
      return SegmentOutcome.INCONSISTENT_TOTAL;
    }
    if (index < 0 || index >= expectedCount) {
      return SegmentOutcome.INDEX_OUT_OF_RANGE;
    }
    if (payloads.containsKey(index)) {
      return SegmentOutcome.DUPLICATE_SEGMENT;
    }
    payloads.put(index, payload.clone());
    return SegmentOutcome.ACCEPTED;
  }

  /**
   * Fixes the expected segment count from an external channel descriptor.
   *
   * @param total declared segment count; positive
   * @return {@link SegmentOutcome#ACCEPTED} when the count was fixed or already matched,
   *     otherwise the rejection reason
   */
  SegmentOutcome expect(int total) {
    if (total <= 0) {
      return SegmentOutcome.INVALID_TOTAL;
    }
    if (expectedCount == UNKNOWN) {
      expectedCount = total;
      return SegmentOutcome.ACCEPTED;
    }
    return expectedCount == total ? SegmentOutcome.ACCEPTED : SegmentOutcome.INCONSISTENT_TOTAL;
  }

  /**
   * Count-based completeness: every expected index has been accepted exactly once.
   *
   * @return {@code true} once the expected count is known and reached
   */
  public boolean isComplete() {
    return expectedCount != UNKNOWN && payloads.size() == expectedCount;
  }

  /**
   * Returns the arrived segments ordered by index. May be called before completion.
   *
   * @return snapshot list of payloads
   */
  public List<SegmentPayload> payloads() {
    List<SegmentPayload> ordered = new ArrayList<>(payloads.size());
    for (Map.Entry<Integer, byte[]> entry : payloads.entrySet()) {
      ordered.add(new SegmentPayload(entry.getKey(), entry.getValue()));
    }
    return ordered;
  }

  /** Returns the expected segment count, or {@code -1} while unknown. */
  public int expectedCount() {
    return expectedCount;
  }

  public int receivedCount() {
    return payloads.size();
  }

  public boolean hasReceived(int index) {
    return payloads.containsKey(index);
  }

  /**
   * Lists the indices still missing; empty while the expected count is unknown.
   *
   * @return ascending missing indices
   */
  public List<Integer> missingIndices() {
    List<Integer> missing = new ArrayList<>();
    for (int i = 0; i < expectedCount; i++) {
      if (!payloads.containsKey(i)) {
        missing.add(i);
      }
    }
    return missing;
  }

  ChannelProgress progress(String name) {
    return new ChannelProgress(name, payloads.size(), expectedCount, isComplete());
  }
}

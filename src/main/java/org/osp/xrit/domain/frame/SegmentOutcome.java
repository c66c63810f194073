package org.osp.xrit.domain.frame;

/**
 * Result of offering one segment to a channel.
 * <p>Every value except {@link #ACCEPTED} means the fragment was dropped and frame state is unchanged.</p>
 *
 * @since 0.1.0
 */
public enum SegmentOutcome {
  /** Segment stored. */
  ACCEPTED,
  /** Declared total disagrees with the total fixed by an earlier segment or descriptor. */
  INCONSISTENT_TOTAL,
  /** Declared total is zero or negative. */
  INVALID_TOTAL,
  /** Index falls outside {@code [0, expectedCount)}. */
  INDEX_OUT_OF_RANGE,
  /** Index was already accepted; the first payload is kept. */
  DUPLICATE_SEGMENT,
  /** The frame's completion was already published; it belongs to the consumer and takes no more data. */
  FRAME_CLOSED,
  /** Notification lacks a satellite, region, frame time or channel key. */
  MALFORMED;

  /**
   * Indicates whether the segment was stored.
   *
   * @return {@code true} only for {@link #ACCEPTED}
   */
  public boolean accepted() {
    return this == ACCEPTED;
  }

  /**
   * Returns the camel-case suffix used in metric keys, e.g. {@code duplicateSegment}.
   *
   * @return metric key suffix
   */
  public String metricSuffix() {
    return switch (this) {
      case ACCEPTED -> "accepted";
      case INCONSISTENT_TOTAL -> "inconsistentTotal";
      case INVALID_TOTAL -> "invalidTotal";
      case INDEX_OUT_OF_RANGE -> "indexOutOfRange";
      case DUPLICATE_SEGMENT -> "duplicateSegment";
      case FRAME_CLOSED -> "frameClosed";
      case MALFORMED -> "malformed";
    };
  }
}

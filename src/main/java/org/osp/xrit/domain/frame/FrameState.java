package org.osp.xrit.domain.frame;

/**
 * Lifecycle position of a {@link FrameGroup}, derived from its current data and flags.
 *
 * @since 0.1.0
 */
public enum FrameState {
  /** No segment accepted yet. */
  EMPTY,
  /** Some segments accepted, frame incomplete and within its window. */
  ACCUMULATING,
  /** All channels complete, consumer has not flagged it processed. */
  COMPLETE,
  /** Complete and flagged {@link ProductFlag#PROCESSED} by the consumer. */
  CONSUMED,
  /** Incomplete and past its accumulation window. */
  TIMED_OUT,
  /** Retries exhausted or marked failed by the owner; terminal. */
  FAILED
}

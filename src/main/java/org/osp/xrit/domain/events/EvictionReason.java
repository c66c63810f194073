package org.osp.xrit.domain.events;

/**
 * Why a frame left the registry without completing.
 *
 * @since 0.1.0
 */
public enum EvictionReason {
  /** Window elapsed before any usable data arrived. */
  TIMED_OUT,
  /** Window elapsed with partial data and no retries left. */
  RETRIES_EXHAUSTED,
  /** Owner marked the frame failed. */
  FAILED,
  /** Removed on request (explicit flush or session shutdown) with whatever data had arrived. */
  FORCED
}

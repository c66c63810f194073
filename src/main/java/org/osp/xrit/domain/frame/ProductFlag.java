package org.osp.xrit.domain.frame;

/**
 * Derived products a consumer reports as handled for a completed frame.
 *
 * @since 0.1.0
 */
public enum ProductFlag {
  /** The frame as a whole has been handled; the sweep reaps complete frames carrying this flag. */
  PROCESSED,
  FALSE_COLOR,
  VISIBLE,
  INFRARED,
  WATER_VAPOUR,
  OTHER_DATA
}

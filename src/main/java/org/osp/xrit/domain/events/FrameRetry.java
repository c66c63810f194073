package org.osp.xrit.domain.events;

import java.util.Objects;
import org.osp.xrit.domain.frame.CompletenessSummary;
import org.osp.xrit.domain.frame.FrameKey;

/**
 * Notification that a timed-out frame was re-armed for another accumulation window. The retry driver
 * reacts by re-requesting the missing segments from the demodulator.
 *
 * @param key frame identity
 * @param summary completeness when the window elapsed
 * @param retryCount retry count after re-arming, starting at 1
 * @since 0.1.0
 */
public record FrameRetry(FrameKey key, CompletenessSummary summary, int retryCount) {

  public FrameRetry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(summary, "summary");
  }
}

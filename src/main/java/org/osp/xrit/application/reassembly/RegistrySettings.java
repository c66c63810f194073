package org.osp.xrit.application.reassembly;

import java.time.Duration;
import java.util.Objects;
import org.osp.xrit.domain.frame.FrameGroup;

/**
 * Tuning for a {@link GroupRegistry}.
 *
 * @param timeout accumulation window per attempt; positive
 * @param maxRetries how many extra windows a timed-out frame with partial data is granted; zero or more
 * @param metricsPrefix prefix for metric keys; blank defaults to {@code reassembly}
 * @since 0.1.0
 */
public record RegistrySettings(Duration timeout, int maxRetries, String metricsPrefix) {
  /** Default retry ceiling. */
  public static final int DEFAULT_MAX_RETRIES = 1;

  public RegistrySettings {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0 (was " + maxRetries + ")");
    }
    metricsPrefix = metricsPrefix == null || metricsPrefix.isBlank() ? "reassembly" : metricsPrefix.trim();
  }

  public RegistrySettings(Duration timeout, int maxRetries) {
    this(timeout, maxRetries, "reassembly");
  }

  /**
   * Two-hour window, one retry.
   *
   * @return default settings
   */
  public static RegistrySettings defaults() {
    return new RegistrySettings(FrameGroup.DEFAULT_TIMEOUT, DEFAULT_MAX_RETRIES);
  }
}

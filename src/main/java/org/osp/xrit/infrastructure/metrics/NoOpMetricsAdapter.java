package org.osp.xrit.infrastructure.metrics;

import org.osp.xrit.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; wired when {@code metricsExporter=none}.
 * <p>Thread-safe and stateless.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}

package org.osp.xrit.infrastructure.events;

import java.util.Objects;
import java.util.StringJoiner;
import org.osp.xrit.application.port.FrameGroupListener;
import org.osp.xrit.application.port.MetricsPort;
import org.osp.xrit.domain.events.FrameCompletion;
import org.osp.xrit.domain.events.FrameEviction;
import org.osp.xrit.domain.events.FrameRetry;
import org.osp.xrit.domain.frame.FrameGroup;
import org.osp.xrit.domain.frame.ProductFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs frame hand-offs as structured lines and updates listener metrics.
 * <p>When {@code consumeOnCompletion} is set the listener acts as a terminal sink: it flags each completed
 * frame {@link ProductFlag#PROCESSED} so the next sweep reaps it.</p>
 */
public final class LoggingFrameGroupListener implements FrameGroupListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingFrameGroupListener.class);

  private final MetricsPort metrics;
  private final String metricPrefix;
  private final boolean consumeOnCompletion;

  /**
   * Creates a logging listener.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters; blank defaults to {@code frameEvents}
   * @param consumeOnCompletion whether completed frames are flagged processed after logging
   */
  public LoggingFrameGroupListener(MetricsPort metrics, String metricPrefix, boolean consumeOnCompletion) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "frameEvents" : metricPrefix.trim();
    this.consumeOnCompletion = consumeOnCompletion;
  }

  public LoggingFrameGroupListener(MetricsPort metrics) {
    this(metrics, "frameEvents", false);
  }

  public LoggingFrameGroupListener() {
    this(MetricsPort.NO_OP);
  }

  @Override
  public void onCompletion(FrameCompletion completion) {
    Objects.requireNonNull(completion, "completion");
    FrameGroup group = completion.group();
    metrics.increment(metricPrefix + ".completed");

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("frame=" + group.key());
    joiner.add("created=" + group.created());
    joiner.add("segments=" + group.summary().receivedSegments());
    joiner.add("channels=" + group.summary());
    completion.geoReference().ifPresent(geo -> joiner.add("subLongitude=" + geo.satelliteLongitudeDeg()));
    log.info("frame.complete {}", joiner);

    if (consumeOnCompletion) {
      group.markProcessed(ProductFlag.PROCESSED);
    }
  }

  @Override
  public void onEviction(FrameEviction eviction) {
    Objects.requireNonNull(eviction, "eviction");
    metrics.increment(metricPrefix + ".evicted");
    if (eviction.failed()) {
      log.warn("frame.evicted frame={}, reason={}, failed=true, channels={}",
          eviction.key(), eviction.reason(), eviction.summary());
    } else {
      log.info("frame.evicted frame={}, reason={}, failed=false, channels={}",
          eviction.key(), eviction.reason(), eviction.summary());
    }
  }

  @Override
  public void onRetry(FrameRetry retry) {
    Objects.requireNonNull(retry, "retry");
    metrics.increment(metricPrefix + ".retried");
    log.info("frame.retry frame={}, attempt={}, channels={}", retry.key(), retry.retryCount(), retry.summary());
  }
}

package org.osp.xrit.config;

import java.util.Objects;
import org.osp.xrit.application.pipeline.ReassemblySession;
import org.osp.xrit.application.port.ClockPort;
import org.osp.xrit.application.port.FrameGroupListener;
import org.osp.xrit.application.port.GeoReferenceCatalog;
import org.osp.xrit.application.port.MetricsPort;
import org.osp.xrit.application.reassembly.GroupRegistry;
import org.osp.xrit.infrastructure.events.LoggingFrameGroupListener;
import org.osp.xrit.infrastructure.exec.ExecutorFactories;
import org.osp.xrit.infrastructure.geo.StaticGeoReferenceCatalog;
import org.osp.xrit.infrastructure.metrics.NoOpMetricsAdapter;
import org.osp.xrit.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.osp.xrit.infrastructure.time.SystemClockAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the reassembly registry and session to concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-object translation in one place so the CLI and embedding
 * applications build identical graphs.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods are not synchronized and
 * are intended for startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ReassemblyConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public CompositionRoot(ReassemblyConfig config) {
    this(config, new SystemClockAdapter(), createMetrics(config));
  }

  /**
   * Creates a root with explicit clock and metrics, used by tests and embedding applications.
   *
   * @param config session configuration
   * @param clock time source
   * @param metrics metrics sink
   */
  public CompositionRoot(ReassemblyConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public GeoReferenceCatalog geoReferenceCatalog() {
    if (config.geoReferences().isEmpty()) {
      return GeoReferenceCatalog.EMPTY;
    }
    return new StaticGeoReferenceCatalog(config.geoReferences());
  }

  public GroupRegistry groupRegistry(FrameGroupListener listener) {
    return new GroupRegistry(config.registrySettings(), clock, metrics, listener, geoReferenceCatalog());
  }

  /**
   * Builds an unstarted session delivering frames to {@code listener}.
   *
   * @param listener frame consumer
   * @return session; call {@link ReassemblySession#start()} to begin sweeping
   */
  public ReassemblySession reassemblySession(FrameGroupListener listener) {
    Objects.requireNonNull(listener, "listener");
    log.info("Building reassembly session (timeout={}, maxRetries={}, sweep={}, geoReferences={})",
        config.timeout(), config.maxRetries(), config.sweepInterval(), config.geoReferences().size());
    return new ReassemblySession(
        groupRegistry(listener),
        config.sweepInterval(),
        () -> ExecutorFactories.newSweepScheduler("xrit-sweep",
            (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex)));
  }

  /**
   * Listener that only logs frame lifecycle events; completed frames are flagged processed so the sweep
   * reaps them.
   *
   * @return logging listener sharing this root's metrics
   */
  public FrameGroupListener loggingListener() {
    return new LoggingFrameGroupListener(metrics, "frameEvents", true);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  private static MetricsPort createMetrics(ReassemblyConfig config) {
    return config.metricsEnabled()
        ? new OpenTelemetryMetricsAdapter(config.metricsExporter())
        : new NoOpMetricsAdapter();
  }
}

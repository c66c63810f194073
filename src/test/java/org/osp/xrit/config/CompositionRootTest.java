package org.osp.xrit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.osp.xrit.application.pipeline.ReassemblySession;
import org.osp.xrit.application.port.GeoReferenceCatalog;
import org.osp.xrit.application.reassembly.GroupRegistry;
import org.osp.xrit.domain.frame.FrameKey;
import org.osp.xrit.infrastructure.events.InMemoryFrameGroupListener;
import org.osp.xrit.infrastructure.events.LoggingFrameGroupListener;
import org.osp.xrit.infrastructure.geo.StaticGeoReferenceCatalog;
import org.osp.xrit.infrastructure.metrics.NoOpMetricsAdapter;
import org.osp.xrit.testing.ManualClock;
import org.osp.xrit.testing.RecordingMetricsPort;

class CompositionRootTest {

  @Test
  void defaultConfigurationUsesNoOpMetricsAndEmptyCatalog() {
    CompositionRoot root = new CompositionRoot(ReassemblyConfig.defaults());

    assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    assertSame(GeoReferenceCatalog.EMPTY, root.geoReferenceCatalog());
  }

  @Test
  void geoEntriesBecomeAStaticCatalog() {
    ReassemblyConfig config = ReassemblyConfig.fromMap(Map.of(
        "geo.MSG4.longitude", "0.0",
        "geo.MSG4.coff", "1856",
        "geo.MSG4.loff", "1856",
        "geo.MSG4.cfac", "11927",
        "geo.MSG4.lfac", "11927"));
    CompositionRoot root = new CompositionRoot(config, new ManualClock(0L), new RecordingMetricsPort());

    GeoReferenceCatalog catalog = root.geoReferenceCatalog();

    assertInstanceOf(StaticGeoReferenceCatalog.class, catalog);
    assertTrue(catalog.resolve(new FrameKey("MSG4", "FD", Instant.EPOCH)).isPresent());
  }

  @Test
  void sessionIsWiredWithConfiguredSettings() {
    ReassemblyConfig config = ReassemblyConfig.fromMap(Map.of("timeoutSeconds", "60", "maxRetries", "0"));
    CompositionRoot root = new CompositionRoot(config, new ManualClock(0L), new RecordingMetricsPort());

    try (ReassemblySession session = root.reassemblySession(new InMemoryFrameGroupListener())) {
      GroupRegistry registry = session.registry();
      assertEquals(60, registry.settings().timeout().toSeconds());
      assertEquals(0, registry.settings().maxRetries());
    }
  }

  @Test
  void loggingListenerConsumesCompletedFrames() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CompositionRoot root = new CompositionRoot(ReassemblyConfig.defaults(), new ManualClock(0L), metrics);

    assertInstanceOf(LoggingFrameGroupListener.class, root.loggingListener());
    GroupRegistry registry = root.groupRegistry(root.loggingListener());
    Instant t = Instant.parse("2024-01-01T00:00:00Z");
    registry.onSegment("MSG4", "FD", t, "VIS", 0, 1, new byte[] {1});
    registry.onSegment("MSG4", "FD", t, "IR", 0, 1, new byte[] {2});
    registry.onSegment("MSG4", "FD", t, "WV", 0, 1, new byte[] {3});

    assertEquals(1, registry.sweep().reaped());
    assertEquals(0, registry.size());
  }
}

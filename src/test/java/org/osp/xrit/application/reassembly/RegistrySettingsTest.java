package org.osp.xrit.application.reassembly;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RegistrySettingsTest {

  @Test
  void defaultsToTwoHoursAndOneRetry() {
    RegistrySettings settings = RegistrySettings.defaults();

    assertEquals(Duration.ofHours(2), settings.timeout());
    assertEquals(1, settings.maxRetries());
    assertEquals("reassembly", settings.metricsPrefix());
  }

  @Test
  void blankPrefixFallsBackToDefault() {
    assertEquals("reassembly", new RegistrySettings(Duration.ofMinutes(1), 0, " ").metricsPrefix());
    assertEquals("rx", new RegistrySettings(Duration.ofMinutes(1), 0, " rx ").metricsPrefix());
  }

  @Test
  void rejectsNonPositiveTimeoutAndNegativeRetries() {
    assertThrows(IllegalArgumentException.class, () -> new RegistrySettings(Duration.ZERO, 1));
    assertThrows(IllegalArgumentException.class, () -> new RegistrySettings(Duration.ofSeconds(-1), 1));
    assertThrows(IllegalArgumentException.class, () -> new RegistrySettings(Duration.ofSeconds(1), -1));
  }
}

package org.osp.xrit.domain.frame;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class FrameKeyTest {
  private static final Instant TIME = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void namesAreTrimmedAndRendered() {
    FrameKey key = new FrameKey(" MSG4 ", "FD", TIME);

    assertEquals("MSG4", key.satelliteName());
    assertEquals("MSG4/FD@2024-05-01T12:00:00Z", key.toString());
    assertEquals(new FrameKey("MSG4", "FD", TIME), key);
  }

  @Test
  void rejectsMissingComponents() {
    assertThrows(IllegalArgumentException.class, () -> new FrameKey("", "FD", TIME));
    assertThrows(NullPointerException.class, () -> new FrameKey("MSG4", null, TIME));
    assertThrows(NullPointerException.class, () -> new FrameKey("MSG4", "FD", null));
  }

  @Test
  void noticeDerivesItsFrameKeyAndTreatsNullPayloadAsEmpty() {
    SegmentNotice notice = new SegmentNotice("MSG4", "FD", TIME, "VIS", 0, 1, null);

    assertEquals(new FrameKey("MSG4", "FD", TIME), notice.frameKey());
    assertArrayEquals(new byte[0], notice.payload());
  }

  @Test
  void noticeReportsMissingHeaderFields() {
    assertTrue(new SegmentNotice("MSG4", "FD", TIME, "VIS", 0, 1, null).defect().isEmpty());
    assertEquals("missing satelliteName", new SegmentNotice(null, "FD", TIME, "VIS", 0, 1, null).defect().orElseThrow());
    assertEquals("missing regionName", new SegmentNotice("MSG4", " ", TIME, "VIS", 0, 1, null).defect().orElseThrow());
    assertEquals("missing frameTime", new SegmentNotice("MSG4", "FD", null, "VIS", 0, 1, null).defect().orElseThrow());
    assertEquals("missing channelKey", new SegmentNotice("MSG4", "FD", TIME, "", 0, 1, null).defect().orElseThrow());
  }

  @Test
  void channelAliasesResolveCaseInsensitively() {
    assertEquals(ChannelKind.VISIBLE, ChannelKind.fromKey(" vs ").orElseThrow());
    assertEquals(ChannelKind.WATER_VAPOUR, ChannelKind.fromKey("WaterVapor").orElseThrow());
    assertEquals(ChannelKind.INFRARED, ChannelKind.fromKey("ir").orElseThrow());
    assertTrue(ChannelKind.fromKey("HRV").isEmpty());
  }
}

package org.osp.xrit.domain.frame;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChannelAggregatorTest {

  @Test
  void outOfOrderSegmentsCompleteAndComeBackInIndexOrder() {
    ChannelAggregator channel = new ChannelAggregator();

    assertEquals(SegmentOutcome.ACCEPTED, channel.addSegment(2, 3, new byte[] {3}));
    assertEquals(SegmentOutcome.ACCEPTED, channel.addSegment(0, 3, new byte[] {1}));
    assertFalse(channel.isComplete());
    assertEquals(List.of(1), channel.missingIndices());
    assertEquals(SegmentOutcome.ACCEPTED, channel.addSegment(1, 3, new byte[] {2}));

    assertTrue(channel.isComplete());
    List<SegmentPayload> payloads = channel.payloads();
    assertEquals(3, payloads.size());
    for (int i = 0; i < payloads.size(); i++) {
      assertEquals(i, payloads.get(i).index());
      assertArrayEquals(new byte[] {(byte) (i + 1)}, payloads.get(i).bytes());
    }
  }

  @Test
  void emptyChannelIsNotComplete() {
    ChannelAggregator channel = new ChannelAggregator();

    assertFalse(channel.isComplete());
    assertEquals(ChannelAggregator.UNKNOWN, channel.expectedCount());
    assertTrue(channel.missingIndices().isEmpty());
  }

  @Test
  void duplicateKeepsFirstPayload() {
    ChannelAggregator channel = new ChannelAggregator();
    channel.addSegment(0, 2, new byte[] {7});

    assertEquals(SegmentOutcome.DUPLICATE_SEGMENT, channel.addSegment(0, 2, new byte[] {9}));

    assertEquals(1, channel.receivedCount());
    assertArrayEquals(new byte[] {7}, channel.payloads().get(0).bytes());
  }

  @Test
  void conflictingTotalIsRejectedWithoutChangingState() {
    ChannelAggregator channel = new ChannelAggregator();
    channel.addSegment(0, 4, new byte[] {1});

    assertEquals(SegmentOutcome.INCONSISTENT_TOTAL, channel.addSegment(1, 5, new byte[] {2}));

    assertEquals(4, channel.expectedCount());
    assertEquals(1, channel.receivedCount());
    assertFalse(channel.hasReceived(1));
  }

  @Test
  void indexOutsideDeclaredTotalIsRejected() {
    ChannelAggregator channel = new ChannelAggregator();

    assertEquals(SegmentOutcome.INDEX_OUT_OF_RANGE, channel.addSegment(3, 3, new byte[0]));
    assertEquals(SegmentOutcome.INDEX_OUT_OF_RANGE, channel.addSegment(-1, 3, new byte[0]));
    assertEquals(0, channel.receivedCount());
  }

  @Test
  void nonPositiveTotalIsRejectedAndLeavesCountUnknown() {
    ChannelAggregator channel = new ChannelAggregator();

    assertEquals(SegmentOutcome.INVALID_TOTAL, channel.addSegment(0, 0, new byte[] {1}));

    assertEquals(ChannelAggregator.UNKNOWN, channel.expectedCount());
    assertEquals(SegmentOutcome.ACCEPTED, channel.addSegment(0, 1, new byte[] {1}));
    assertTrue(channel.isComplete());
  }

  @Test
  void payloadIsCopiedOnAcceptance() {
    ChannelAggregator channel = new ChannelAggregator();
    byte[] buffer = {1, 2, 3};
    channel.addSegment(0, 1, buffer);

    buffer[0] = 42;

    assertArrayEquals(new byte[] {1, 2, 3}, channel.payloads().get(0).bytes());
  }

  @Test
  void declaredTotalMustMatchLaterSegments() {
    ChannelAggregator channel = new ChannelAggregator();

    assertEquals(SegmentOutcome.ACCEPTED, channel.expect(2));
    assertEquals(SegmentOutcome.INCONSISTENT_TOTAL, channel.addSegment(0, 3, new byte[0]));
    assertEquals(SegmentOutcome.ACCEPTED, channel.addSegment(0, 2, new byte[0]));
    assertEquals(SegmentOutcome.INCONSISTENT_TOTAL, channel.expect(5));
    assertEquals(SegmentOutcome.INVALID_TOTAL, channel.expect(0));
  }

  @Test
  void nullPayloadIsAProgrammingError() {
    ChannelAggregator channel = new ChannelAggregator();

    assertThrows(NullPointerException.class, () -> channel.addSegment(0, 1, null));
  }
}

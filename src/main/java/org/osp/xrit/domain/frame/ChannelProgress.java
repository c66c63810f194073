package org.osp.xrit.domain.frame;

/**
 * Arrival progress of one channel at a point in time.
 *
 * @param channel channel name ({@code VISIBLE}, {@code INFRARED}, {@code WATER_VAPOUR} or an auxiliary key)
 * @param received number of accepted segments
 * @param expected expected segment count, {@code -1} while unknown
 * @param complete whether the channel is complete
 * @since 0.1.0
 */
public record ChannelProgress(String channel, int received, int expected, boolean complete) {

  @Override
  public String toString() {
    String total = expected < 0 ? "?" : Integer.toString(expected);
    return channel + " " + received + "/" + total + " (" + (complete ? "Complete" : "Incomplete") + ")";
  }
}

package org.osp.xrit.domain.frame;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One segment as delivered by the demodulator/depacketizer.
 * <p><strong>Role:</strong> Inbound domain value consumed by the group registry.</p>
 * <p>Header fields are carried as received; {@link #defect()} reports a notice the registry must drop.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from the payload buffer, which callers must not
 * mutate after constructing the notice.</p>
 *
 * @param satelliteName satellite that captured the frame
 * @param regionName scan region
 * @param frameTime nominal capture time of the frame
 * @param channelKey channel the segment belongs to
 * @param segmentIndex zero-based index within the channel
 * @param segmentTotal declared segment count for the channel
 * @param payload fragment bytes; {@code null} becomes an empty array
 * @since 0.1.0
 */
public record SegmentNotice(
    String satelliteName,
    String regionName,
    Instant frameTime,
    String channelKey,
    int segmentIndex,
    int segmentTotal,
    byte[] payload) {

  public SegmentNotice {
    payload = payload != null ? payload : new byte[0];
  }

  /**
   * Describes the first missing header field, if any.
   *
   * @return reason the notice cannot be routed, or empty when it is well formed
   */
  public Optional<String> defect() {
    if (satelliteName == null || satelliteName.isBlank()) {
      return Optional.of("missing satelliteName");
    }
    if (regionName == null || regionName.isBlank()) {
      return Optional.of("missing regionName");
    }
    if (frameTime == null) {
      return Optional.of("missing frameTime");
    }
    if (channelKey == null || channelKey.isBlank()) {
      return Optional.of("missing channelKey");
    }
    return Optional.empty();
  }

  /**
   * Builds the identity of the frame this segment belongs to.
   *
   * @return frame key
   * @throws NullPointerException if the frame time or a name is {@code null}
   * @throws IllegalArgumentException if satellite or region names are blank
   */
  public FrameKey frameKey() {
    return new FrameKey(satelliteName, regionName, frameTime);
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Channel aggregators copy the payload on acceptance; avoiding a second copy per segment.")
  public byte[] payload() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SegmentNotice other)) {
      return false;
    }
    return segmentIndex == other.segmentIndex
        && segmentTotal == other.segmentTotal
        && Objects.equals(satelliteName, other.satelliteName)
        && Objects.equals(regionName, other.regionName)
        && Objects.equals(frameTime, other.frameTime)
        && Objects.equals(channelKey, other.channelKey)
        && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(satelliteName, regionName, frameTime, channelKey, segmentIndex, segmentTotal);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "SegmentNotice{"
        + "satelliteName=" + satelliteName
        + ", regionName=" + regionName
        + ", frameTime=" + frameTime
        + ", channelKey=" + channelKey
        + ", segmentIndex=" + segmentIndex
        + ", segmentTotal=" + segmentTotal
        + ", payloadLength=" + payload.length
        + '}';
  }
}

package org.osp.xrit.domain.frame;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;

/**
 * One accepted segment of a channel, as handed to exporters.
 *
 * @param index zero-based segment index within the channel
 * @param bytes raw fragment bytes, copied once when the segment was accepted
 * @since 0.1.0
 */
public record SegmentPayload(int index, byte[] bytes) {

  public SegmentPayload {
    bytes = bytes != null ? bytes : new byte[0];
  }

  /**
   * Provides the stored fragment without copying.
   *
   * @return internal buffer; ownership passes to the consumer once the frame is handed off
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Fragment was copied on ingest; completed frames transfer buffer ownership to the exporter.")
  public byte[] bytes() {
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SegmentPayload other)) {
      return false;
    }
    return index == other.index && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * Integer.hashCode(index) + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "SegmentPayload{index=" + index + ", length=" + bytes.length + '}';
  }
}

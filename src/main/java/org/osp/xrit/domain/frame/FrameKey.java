package org.osp.xrit.domain.frame;

import java.time.Instant;
import java.util.Objects;
import org.osp.xrit.validation.Strings;

/**
 * <strong>What:</strong> Identity of one multi-channel frame.
 * <p><strong>Role:</strong> Opaque composite key used by the group registry; at most one live group exists
 * per key.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param satelliteName satellite that captured the frame; trimmed, non-blank
 * @param regionName scan region (e.g. full disk, northern hemisphere); trimmed, non-blank
 * @param frameTime nominal capture time
 * @since 0.1.0
 */
public record FrameKey(String satelliteName, String regionName, Instant frameTime) {

  /**
   * Normalizes names and rejects missing components.
   *
   * @throws NullPointerException if any component is {@code null}
   * @throws IllegalArgumentException if a name is blank
   */
  public FrameKey {
    satelliteName = Strings.requireNonBlank("satelliteName", satelliteName);
    regionName = Strings.requireNonBlank("regionName", regionName);
    frameTime = Objects.requireNonNull(frameTime, "frameTime");
  }

  @Override
  public String toString() {
    return satelliteName + "/" + regionName + "@" + frameTime;
  }
}

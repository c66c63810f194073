package org.osp.xrit.domain.frame;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed spectral channels every frame carries. Channel keys that match none of these are routed to
 * a frame's auxiliary channels.
 *
 * @since 0.1.0
 */
public enum ChannelKind {
  VISIBLE(Set.of("VIS", "VS", "VISIBLE")),
  INFRARED(Set.of("IR", "INFRARED")),
  WATER_VAPOUR(Set.of("WV", "WATERVAPOUR", "WATER_VAPOUR", "WATERVAPOR", "WATER_VAPOR"));

  private final Set<String> aliases;

  ChannelKind(Set<String> aliases) {
    this.aliases = aliases;
  }

  /**
   * Resolves a channel key to a fixed channel, ignoring case and surrounding whitespace.
   *
   * @param channelKey key from a segment notification; {@code null} yields empty
   * @return fixed channel, or empty for auxiliary keys
   */
  public static Optional<ChannelKind> fromKey(String channelKey) {
    if (channelKey == null) {
      return Optional.empty();
    }
    String normalized = channelKey.trim().toUpperCase(Locale.ROOT);
    for (ChannelKind kind : values()) {
      if (kind.aliases.contains(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}

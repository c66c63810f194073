package org.osp.xrit.infrastructure.time;

import org.osp.xrit.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}; used for frame creation stamps and
 * timeout checks in production wiring.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}

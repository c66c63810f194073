package org.osp.xrit.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the reassembly pipeline.
 * <p><strong>Why:</strong> Frame timeouts are polled against the clock; injecting it keeps eviction
 * decisions deterministic in tests.</p>
 * <p><strong>Role:</strong> Port consumed by the group registry and frame groups.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the producer path and the sweep
 * read the clock concurrently.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see org.osp.xrit.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}

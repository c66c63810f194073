package org.osp.xrit.application.reassembly;

/**
 * Counts of actions taken by one registry sweep.
 *
 * @param inspected live groups examined
 * @param retried groups re-armed for another window
 * @param evicted incomplete groups removed (timed out, failed or retries exhausted)
 * @param reaped complete groups removed after the consumer flagged them processed
 * @since 0.1.0
 */
public record SweepReport(int inspected, int retried, int evicted, int reaped) {

  /** Returns {@code true} when the sweep changed nothing. */
  public boolean idle() {
    return retried == 0 && evicted == 0 && reaped == 0;
  }
}

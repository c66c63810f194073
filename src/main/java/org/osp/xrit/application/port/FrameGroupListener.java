package org.osp.xrit.application.port;

import org.osp.xrit.domain.events.FrameCompletion;
import org.osp.xrit.domain.events.FrameEviction;
import org.osp.xrit.domain.events.FrameRetry;

/**
 * <strong>What:</strong> Port through which the registry hands frames to the exporter/compositor.
 * <p><strong>Why:</strong> Decouples reassembly from rendering, export and retry drivers.</p>
 * <p><strong>Role:</strong> Outbound port implemented by adapters (logging, in-memory, exporters).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Receive each completed frame exactly once.</li>
 *   <li>Receive removals of incomplete frames, including failed ones.</li>
 *   <li>Optionally react to re-armed frames by re-requesting missing segments.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Callbacks arrive on producer threads (completion) and on the sweep
 * thread (eviction, retry); implementations must tolerate concurrent calls. Callbacks are invoked
 * outside any frame lock.</p>
 * <p><strong>Observability:</strong> Exceptions thrown by implementations are logged and counted under
 * {@code reassembly.listener.failed}; they never affect the registry.</p>
 *
 * @since 0.1.0
 */
public interface FrameGroupListener {
  /**
   * Called once when a frame's completeness transitions from false to true.
   *
   * @param completion completed frame and its navigation
   */
  void onCompletion(FrameCompletion completion);

  /**
   * Called when an incomplete frame is removed.
   *
   * @param eviction removed frame identity, summary and reason
   */
  void onEviction(FrameEviction eviction);

  /**
   * Called when a timed-out frame is granted another accumulation window.
   *
   * @param retry re-armed frame identity and retry count
   */
  default void onRetry(FrameRetry retry) {}

  /**
   * Listener that ignores all notifications.
   */
  FrameGroupListener NO_OP = new FrameGroupListener() {
    @Override public void onCompletion(FrameCompletion completion) {}

    @Override public void onEviction(FrameEviction eviction) {}
  };
}

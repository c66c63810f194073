package org.osp.xrit.infrastructure.events;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.osp.xrit.application.port.FrameGroupListener;
import org.osp.xrit.domain.events.FrameCompletion;
import org.osp.xrit.domain.events.FrameEviction;
import org.osp.xrit.domain.events.FrameRetry;

/**
 * Captures frame notifications in memory; used by tests and diagnostics.
 */
public final class InMemoryFrameGroupListener implements FrameGroupListener {
  private final CopyOnWriteArrayList<FrameCompletion> completions = new CopyOnWriteArrayList<>();
  private final CopyOnWriteArrayList<FrameEviction> evictions = new CopyOnWriteArrayList<>();
  private final CopyOnWriteArrayList<FrameRetry> retries = new CopyOnWriteArrayList<>();

  @Override
  public void onCompletion(FrameCompletion completion) {
    completions.add(Objects.requireNonNull(completion, "completion"));
  }

  @Override
  public void onEviction(FrameEviction eviction) {
    evictions.add(Objects.requireNonNull(eviction, "eviction"));
  }

  @Override
  public void onRetry(FrameRetry retry) {
    retries.add(Objects.requireNonNull(retry, "retry"));
  }

  public List<FrameCompletion> completions() {
    return List.copyOf(completions);
  }

  public List<FrameEviction> evictions() {
    return List.copyOf(evictions);
  }

  public List<FrameRetry> retries() {
    return List.copyOf(retries);
  }
}

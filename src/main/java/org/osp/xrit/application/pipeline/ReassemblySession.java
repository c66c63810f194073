package org.osp.xrit.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.osp.xrit.application.reassembly.GroupRegistry;
import org.osp.xrit.application.reassembly.SweepReport;
import org.osp.xrit.domain.frame.SegmentNotice;
import org.osp.xrit.domain.frame.SegmentOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs a {@link GroupRegistry} for one ingestion session: accepts segments from
 * any number of producer threads and drives the periodic timeout sweep.
 * <p><strong>Why:</strong> The registry polls for timeouts rather than scheduling a timer per frame; the
 * session owns the single sweep thread and guarantees an orderly drain on shutdown.</p>
 * <p><strong>Thread-safety:</strong> {@link #submit(SegmentNotice)} may be called concurrently;
 * {@link #start()} and {@link #close()} are idempotent. Submissions hold the read side of an ingest lock
 * and {@link #close()} takes the write side, so no segment reaches the registry after the final drain.</p>
 *
 * @since 0.1.0
 */
public final class ReassemblySession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ReassemblySession.class);

  private final GroupRegistry registry;
  private final Duration sweepInterval;
  private final Supplier<ScheduledExecutorService> schedulerFactory;
  private final ReadWriteLock ingestLock = new ReentrantReadWriteLock();
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> sweepTask;
  private boolean closed;

  /**
   * Creates a session.
   *
   * @param registry registry receiving segments
   * @param sweepInterval delay between timeout sweeps; positive
   * @param schedulerFactory supplies the scheduler on {@link #start()}
   */
  public ReassemblySession(
      GroupRegistry registry, Duration sweepInterval, Supplier<ScheduledExecutorService> schedulerFactory) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      throw new IllegalArgumentException("sweepInterval must be positive");
    }
    this.schedulerFactory = Objects.requireNonNull(schedulerFactory, "schedulerFactory");
  }

  /**
   * Starts the periodic sweep.
   *
   * @throws IllegalStateException if the session has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("session closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = schedulerFactory.get();
    long periodMillis = sweepInterval.toMillis();
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweepOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    log.info("Reassembly session started; sweeping every {} ms", periodMillis);
  }

  /**
   * Routes one segment into the registry.
   *
   * @param notice segment notification
   * @return outcome reported by the registry
   * @throws IllegalStateException if the session has been closed
   */
  public SegmentOutcome submit(SegmentNotice notice) {
    ingestLock.readLock().lock();
    try {
      synchronized (this) {
        if (closed) {
          throw new IllegalStateException("session closed");
        }
      }
      return registry.onSegment(notice);
    } finally {
      ingestLock.readLock().unlock();
    }
  }

  /**
   * Runs one sweep on the caller's thread. Failures are logged rather than propagated so the scheduled
   * sweep keeps running.
   *
   * @return sweep report, or an idle report when the sweep failed
   */
  public SweepReport sweepOnce() {
    try {
      return registry.sweep();
    } catch (RuntimeException ex) {
      log.error("Timeout sweep failed", ex);
      return new SweepReport(0, 0, 0, 0);
    }
  }

  public GroupRegistry registry() {
    return registry;
  }

  public synchronized boolean isRunning() {
    return sweepTask != null && !closed;
  }

  /**
   * Stops the sweep and force-removes every live frame.
   */
  @Override
  public void close() {
    ScheduledExecutorService toStop;
    // Waits for in-flight submissions; later ones see closed.
    ingestLock.writeLock().lock();
    try {
      synchronized (this) {
        if (closed) {
          return;
        }
        closed = true;
        toStop = scheduler;
        if (sweepTask != null) {
          sweepTask.cancel(false);
        }
      }
    } finally {
      ingestLock.writeLock().unlock();
    }
    if (toStop != null) {
      toStop.shutdown();
      try {
        if (!toStop.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Sweep scheduler did not terminate within 5 seconds");
          toStop.shutdownNow();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        toStop.shutdownNow();
      }
    }
    int drained = registry.drain();
    log.info("Reassembly session closed; {} frames drained", drained);
  }
}

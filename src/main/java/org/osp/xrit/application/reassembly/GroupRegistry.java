package org.osp.xrit.application.reassembly;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import org.osp.xrit.application.port.ClockPort;
import org.osp.xrit.application.port.FrameGroupListener;
import org.osp.xrit.application.port.GeoReferenceCatalog;
import org.osp.xrit.application.port.MetricsPort;
import org.osp.xrit.domain.events.EvictionReason;
import org.osp.xrit.domain.events.FrameCompletion;
import org.osp.xrit.domain.events.FrameEviction;
import org.osp.xrit.domain.events.FrameRetry;
import org.osp.xrit.domain.frame.FrameGroup;
import org.osp.xrit.domain.frame.FrameKey;
import org.osp.xrit.domain.frame.SegmentNotice;
import org.osp.xrit.domain.frame.SegmentOutcome;
import org.osp.xrit.domain.geo.GeoReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Table of live frame groups keyed by {@link FrameKey}; routes segments, detects
 * completion and sweeps stale frames.
 * <p><strong>Why:</strong> Segments for many frames and channels arrive interleaved and out of order from
 * several demodulator sources; the registry is the single place that owns frame state until hand-off.</p>
 * <p><strong>Role:</strong> Application service between the segment source and the
 * {@link FrameGroupListener}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create a group on the first segment of an unseen frame and route every segment to it.</li>
 *   <li>Publish each frame's completion exactly once, on the false to true edge.</li>
 *   <li>Re-arm, fail or evict timed-out incomplete frames; reap consumed frames.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Any number of producer threads and one sweep thread may call in
 * concurrently. Each group's monitor serializes work on that frame; unrelated frames never contend.
 * Groups are retired under their monitor before removal so a producer holding a stale reference
 * re-resolves instead of writing into a removed frame. Listener callbacks run outside frame locks.</p>
 * <p><strong>Observability:</strong> Emits {@code reassembly.segment.*}, {@code reassembly.group.*} and
 * {@code reassembly.groups.live} metrics.</p>
 *
 * @since 0.1.0
 */
public final class GroupRegistry {
  private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

  private final ConcurrentMap<FrameKey, FrameGroup> groups = new ConcurrentHashMap<>();
  private final RegistrySettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final FrameGroupListener listener;
  private final GeoReferenceCatalog catalog;
  private final String prefix;

  /**
   * Creates a registry.
   *
   * @param settings timeout and retry policy
   * @param clock time source for frame creation and timeouts
   * @param metrics metrics sink
   * @param listener consumer of completions, evictions and retries
   * @param catalog fallback navigation lookup for frames without an attached geo reference
   */
  public GroupRegistry(
      RegistrySettings settings,
      ClockPort clock,
      MetricsPort metrics,
      FrameGroupListener listener,
      GeoReferenceCatalog catalog) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.prefix = settings.metricsPrefix();
  }

  /**
   * Routes one segment, creating its frame group on first sight.
   *
   * @param satelliteName satellite name
   * @param regionName region name
   * @param frameTime frame capture time
   * @param channelKey channel key
   * @param index zero-based segment index
   * @param total declared segment count for the channel
   * @param payload fragment bytes
   * @return outcome; rejected fragments are logged and dropped
   */
  public SegmentOutcome onSegment(
      String satelliteName,
      String regionName,
      Instant frameTime,
      String channelKey,
      int index,
      int total,
      byte[] payload) {
    return onSegment(new SegmentNotice(satelliteName, regionName, frameTime, channelKey, index, total, payload));
  }

  /**
   * Routes one segment, creating its frame group on first sight.
   *
   * @param notice segment notification
   * @return outcome; rejected fragments are logged and dropped
   */
  public SegmentOutcome onSegment(SegmentNotice notice) {
    Objects.requireNonNull(notice, "notice");
    Optional<String> defect = notice.defect();
    if (defect.isPresent()) {
      metrics.increment(prefix + ".segment." + SegmentOutcome.MALFORMED.metricSuffix());
      log.warn("Dropped malformed segment {}: {}", notice, defect.get());
      return SegmentOutcome.MALFORMED;
    }
    FrameKey key = notice.frameKey();
    SegmentOutcome outcome;
    FrameGroup completed = null;
    while (true) {
      FrameGroup group = groups.computeIfAbsent(key, this::newGroup);
      synchronized (group) {
        if (group.isRetired()) {
          continue;
        }
        boolean wasComplete = group.isComplete();
        outcome = group.routeSegment(
            notice.channelKey(), notice.segmentIndex(), notice.segmentTotal(), notice.payload());
        if (!wasComplete && group.isComplete() && group.claimCompletion()) {
          completed = group;
        }
      }
      break;
    }

    metrics.increment(prefix + ".segment." + outcome.metricSuffix());
    if (outcome.accepted()) {
      metrics.observe(prefix + ".segment.bytes", notice.payload().length);
      log.debug("Accepted segment {}/{} of {} channel {}",
          notice.segmentIndex(), notice.segmentTotal(), key, notice.channelKey());
    } else {
      log.warn("Dropped segment {}/{} of {} channel {}: {}",
          notice.segmentIndex(), notice.segmentTotal(), key, notice.channelKey(), outcome);
    }

    if (completed != null) {
      publishCompletion(completed);
    }
    return outcome;
  }

  /**
   * Fixes a channel's expected segment count from an external descriptor.
   *
   * @param key frame identity; the group is created if absent
   * @param channelKey channel key
   * @param total declared segment count
   * @return outcome reported by the channel
   */
  public SegmentOutcome declareChannel(FrameKey key, String channelKey, int total) {
    Objects.requireNonNull(key, "key");
    while (true) {
      FrameGroup group = groups.computeIfAbsent(key, this::newGroup);
      synchronized (group) {
        if (group.isRetired()) {
          continue;
        }
        SegmentOutcome outcome = group.declareChannel(channelKey, total);
        if (!outcome.accepted()) {
          log.warn("Rejected descriptor for {} channel {} total {}: {}", key, channelKey, total, outcome);
          metrics.increment(prefix + ".descriptor." + outcome.metricSuffix());
        }
        return outcome;
      }
    }
  }

  /**
   * Attaches navigation received with a frame's headers; the group is created if absent.
   *
   * @param key frame identity
   * @param reference navigation for the frame
   */
  public void attachGeoReference(FrameKey key, GeoReference reference) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(reference, "reference");
    while (true) {
      FrameGroup group = groups.computeIfAbsent(key, this::newGroup);
      synchronized (group) {
        if (group.isRetired()) {
          continue;
        }
        group.attachGeoReference(reference);
        return;
      }
    }
  }

  /**
   * Sweeps using the registry clock.
   *
   * @return actions taken
   */
  public SweepReport sweep() {
    return sweep(clock.nowMillis());
  }

  /**
   * Examines every live group once:
   * <ul>
   *   <li>failed groups are evicted with {@code failed=true};</li>
   *   <li>complete or handed-off groups flagged processed are reaped; other complete groups are left
   *       alone whatever their age;</li>
   *   <li>timed-out incomplete groups holding data are re-armed while retries remain, then failed and
   *       evicted; timed-out groups without data are evicted.</li>
   * </ul>
   *
   * @param nowMillis epoch milliseconds used for timeout checks
   * @return actions taken
   */
  public SweepReport sweep(long nowMillis) {
    int inspected = 0;
    int retried = 0;
    int reaped = 0;
    List<FrameEviction> evictions = new ArrayList<>();
    List<FrameRetry> retries = new ArrayList<>();

    for (FrameGroup group : groups.values()) {
      synchronized (group) {
        if (group.isRetired()) {
          continue;
        }
        inspected++;
        if (group.isFailed()) {
          evictions.add(remove(group, EvictionReason.FAILED));
        } else if (group.completionClaimed() || group.isComplete()) {
          if (group.isProcessed()) {
            remove(group);
            reaped++;
          }
        } else if (group.timedOut(nowMillis)) {
          boolean hasData = group.hasData();
          if (hasData && group.retryCount() < settings.maxRetries()) {
            int count = group.incrementRetry();
            retries.add(new FrameRetry(group.key(), group.summary(), count));
            retried++;
          } else if (hasData) {
            group.markFailed();
            evictions.add(remove(group, EvictionReason.RETRIES_EXHAUSTED));
          } else {
            evictions.add(remove(group, EvictionReason.TIMED_OUT));
          }
        }
      }
    }

    for (FrameRetry retry : retries) {
      metrics.increment(prefix + ".group.retried");
      log.info("Frame {} timed out with {}; retry {}/{}",
          retry.key(), retry.summary(), retry.retryCount(), settings.maxRetries());
      notifyListener(l -> l.onRetry(retry), retry.key());
    }
    for (FrameEviction eviction : evictions) {
      publishEviction(eviction);
    }
    if (reaped > 0) {
      metrics.increment(prefix + ".sweep.reaped");
    }
    metrics.observe(prefix + ".groups.live", groups.size());

    SweepReport report = new SweepReport(inspected, retried, evictions.size(), reaped);
    if (!report.idle()) {
      log.debug("Sweep finished: {}", report);
    }
    return report;
  }

  /**
   * Removes a group the consumer has finished with.
   *
   * @param key frame identity
   * @return the removed group, or empty when no live group has that key
   */
  public Optional<FrameGroup> acknowledge(FrameKey key) {
    FrameGroup group = groups.get(Objects.requireNonNull(key, "key"));
    if (group == null) {
      return Optional.empty();
    }
    synchronized (group) {
      if (group.isRetired()) {
        return Optional.empty();
      }
      remove(group);
    }
    metrics.increment(prefix + ".group.acknowledged");
    log.debug("Frame {} acknowledged by consumer", key);
    return Optional.of(group);
  }

  /**
   * Gives up on a frame: marks every product handled, removes it and, when it never completed, publishes
   * a {@link EvictionReason#FORCED} eviction carrying whatever data arrived.
   *
   * @param key frame identity
   * @return the removed group, or empty when no live group has that key
   */
  public Optional<FrameGroup> forceRemove(FrameKey key) {
    FrameGroup group = groups.get(Objects.requireNonNull(key, "key"));
    if (group == null) {
      return Optional.empty();
    }
    FrameEviction eviction = null;
    synchronized (group) {
      if (group.isRetired()) {
        return Optional.empty();
      }
      group.forceComplete();
      if (group.completionClaimed()) {
        remove(group);
      } else {
        eviction = remove(group, EvictionReason.FORCED);
      }
    }
    if (eviction != null) {
      publishEviction(eviction);
    }
    return Optional.of(group);
  }

  /**
   * Marks a frame failed on behalf of the retry driver; the next sweep evicts it.
   *
   * @param key frame identity
   * @return {@code true} when a live group was marked
   */
  public boolean markFailed(FrameKey key) {
    FrameGroup group = groups.get(Objects.requireNonNull(key, "key"));
    if (group == null) {
      return false;
    }
    synchronized (group) {
      if (group.isRetired()) {
        return false;
      }
      group.markFailed();
      return true;
    }
  }

  /**
   * Force-removes every live group, typically when the ingestion session ends.
   *
   * @return number of groups removed
   */
  public int drain() {
    int removed = 0;
    for (FrameKey key : List.copyOf(groups.keySet())) {
      if (forceRemove(key).isPresent()) {
        removed++;
      }
    }
    if (removed > 0) {
      log.info("Drained {} frame groups", removed);
    }
    return removed;
  }

  public Optional<FrameGroup> find(FrameKey key) {
    return Optional.ofNullable(groups.get(Objects.requireNonNull(key, "key")));
  }

  public List<FrameKey> liveKeys() {
    return List.copyOf(groups.keySet());
  }

  public int size() {
    return groups.size();
  }

  public RegistrySettings settings() {
    return settings;
  }

  private FrameGroup newGroup(FrameKey key) {
    metrics.increment(prefix + ".group.created");
    log.debug("Tracking new frame {}", key);
    return new FrameGroup(key, clock::nowMillis, settings.timeout());
  }

  // Caller holds the group monitor.
  private void remove(FrameGroup group) {
    group.retire();
    groups.remove(group.key(), group);
  }

  private FrameEviction remove(FrameGroup group, EvictionReason reason) {
    remove(group);
    return new FrameEviction(group.key(), group.summary(), group.isFailed(), reason, group);
  }

  private void publishCompletion(FrameGroup group) {
    Optional<GeoReference> geo = group.geoReference().or(() -> catalog.resolve(group.key()));
    metrics.increment(prefix + ".group.completed");
    metrics.observe(prefix + ".group.assemblyMillis", clock.nowMillis() - group.createdMillis());
    log.info("Frame {} complete ({}){}", group.key(), group.summary(),
        geo.isPresent() ? "" : " without geo reference");
    FrameCompletion completion = new FrameCompletion(group, geo);
    notifyListener(l -> l.onCompletion(completion), group.key());
  }

  private void publishEviction(FrameEviction eviction) {
    metrics.increment(prefix + ".group.evicted");
    if (eviction.failed()) {
      metrics.increment(prefix + ".group.failed");
    }
    log.info("Evicted frame {} ({}, failed={}): {}",
        eviction.key(), eviction.reason(), eviction.failed(), eviction.summary());
    notifyListener(l -> l.onEviction(eviction), eviction.key());
  }

  private void notifyListener(Consumer<FrameGroupListener> callback, FrameKey key) {
    try {
      callback.accept(listener);
    } catch (RuntimeException ex) {
      metrics.increment(prefix + ".listener.failed");
      log.error("Frame listener failed for {}", key, ex);
    }
  }
}

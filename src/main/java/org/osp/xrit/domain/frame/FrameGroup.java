package org.osp.xrit.domain.frame;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.LongSupplier;
import org.osp.xrit.domain.geo.GeoReference;

/**
 * <strong>What:</strong> One frame under reassembly: three fixed spectral channels, any number of named
 * auxiliary channels, consumer processing flags and timeout/retry bookkeeping.
 * <p><strong>Role:</strong> Domain aggregate owned by the group registry until it is handed to the
 * consumer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Route segments to the matching {@link ChannelAggregator}.</li>
 *   <li>Derive completeness and staleness from current state on every read.</li>
 *   <li>Carry the consumer's product flags and the owner's retry/failure markers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All methods synchronize on the instance. The registry also holds
 * this monitor across compound check-then-act sequences, so the instance lock is the per-frame lock.</p>
 *
 * @since 0.1.0
 */
public final class FrameGroup {
  /** Default accumulation window. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(2);

  private final FrameKey key;
  private final LongSupplier clock;
  private final long timeoutMillis;
  private final long createdMillis;

  private final ChannelAggregator visible = new ChannelAggregator();
  private final ChannelAggregator infrared = new ChannelAggregator();
  private final ChannelAggregator waterVapour = new ChannelAggregator();
  private final Map<String, ChannelAggregator> otherChannels = new TreeMap<>();
  private final Set<ProductFlag> flags = EnumSet.noneOf(ProductFlag.class);

  private boolean cropImage;
  private int retryCount;
  private boolean failed;
  private GeoReference geoReference;
  private boolean completionClaimed;
  private boolean retired;

  /**
   * Creates an empty group; {@code created} is read once from {@code clock}.
   *
   * @param key frame identity
   * @param clock epoch-millisecond source used for creation and timeout checks
   * @param timeout accumulation window; positive
   */
  public FrameGroup(FrameKey key, LongSupplier clock, Duration timeout) {
    this.key = Objects.requireNonNull(key, "key");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.timeoutMillis = timeout.toMillis();
    this.createdMillis = clock.getAsLong();
  }

  /**
   * Routes a segment to the fixed channel matching {@code channelKey}, or to the auxiliary channel of
   * that name (created on first use).
   *
   * @param channelKey channel key from the segment notification
   * @param index zero-based segment index
   * @param total declared segment count for the channel
   * @param payload fragment bytes
   * @return outcome reported by the channel, or {@link SegmentOutcome#FRAME_CLOSED} once completion was
   *     claimed
   */
  public synchronized SegmentOutcome routeSegment(String channelKey, int index, int total, byte[] payload) {
    if (completionClaimed) {
      return SegmentOutcome.FRAME_CLOSED;
    }
    return channelFor(channelKey).addSegment(index, total, payload);
  }

  /**
   * Fixes a channel's expected segment count from an external descriptor before segments arrive.
   *
   * @param channelKey channel key
   * @param total declared segment count
   * @return outcome reported by the channel
   */
  public synchronized SegmentOutcome declareChannel(String channelKey, int total) {
    if (completionClaimed) {
      return SegmentOutcome.FRAME_CLOSED;
    }
    return channelFor(channelKey).expect(total);
  }

  private ChannelAggregator channelFor(String channelKey) {
    Optional<ChannelKind> kind = ChannelKind.fromKey(channelKey);
    if (kind.isPresent()) {
      return fixedChannel(kind.get());
    }
    String name = Objects.requireNonNull(channelKey, "channelKey").trim();
    if (name.isEmpty()) {
      throw new IllegalArgumentException("channelKey must not be blank");
    }
    return otherChannels.computeIfAbsent(name, k -> new ChannelAggregator());
  }

  private ChannelAggregator fixedChannel(ChannelKind kind) {
    return switch (kind) {
      case VISIBLE -> visible;
      case INFRARED -> infrared;
      case WATER_VAPOUR -> waterVapour;
    };
  }

  public synchronized boolean isComplete() {
    return visible.isComplete()
        && infrared.isComplete()
        && waterVapour.isComplete()
        && otherDataIsComplete();
  }

  /**
   * Completeness of auxiliary channels; vacuously {@code true} when there are none.
   *
   * @return whether every auxiliary channel is complete
   */
  public synchronized boolean otherDataIsComplete() {
    for (ChannelAggregator channel : otherChannels.values()) {
      if (!channel.isComplete()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Checks the accumulation window against the current clock.
   *
   * @return {@code true} when the frame is past its window
   */
  public boolean timedOut() {
    return timedOut(clock.getAsLong());
  }

  /**
   * Checks the accumulation window at {@code nowMillis}. Each retry grants one more window, so the
   * deadline is {@code created + timeout * (retryCount + 1)}.
   *
   * @param nowMillis epoch milliseconds
   * @return {@code true} when {@code now - created} exceeds the current window
   */
  public synchronized boolean timedOut(long nowMillis) {
    return nowMillis - createdMillis > timeoutMillis * (retryCount + 1L);
  }

  /**
   * Gives up on completeness by marking every product as handled. Channel data is untouched.
   */
  public synchronized void forceComplete() {
    flags.addAll(EnumSet.allOf(ProductFlag.class));
  }

  /**
   * Records that the consumer handled a product. Flags are never cleared.
   *
   * @param flag product handled
   */
  public synchronized void markProcessed(ProductFlag flag) {
    flags.add(Objects.requireNonNull(flag, "flag"));
  }

  /** Whether the consumer flagged {@link ProductFlag#PROCESSED}. */
  public synchronized boolean isProcessed() {
    return flags.contains(ProductFlag.PROCESSED);
  }

  public synchronized Set<ProductFlag> processedFlags() {
    return flags.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
  }

  public synchronized boolean cropImage() {
    return cropImage;
  }

  public synchronized void setCropImage(boolean cropImage) {
    this.cropImage = cropImage;
  }

  public synchronized int retryCount() {
    return retryCount;
  }

  /**
   * Records that missing segments were re-requested.
   *
   * @return the new retry count
   */
  public synchronized int incrementRetry() {
    return ++retryCount;
  }

  public synchronized boolean isFailed() {
    return failed;
  }

  /** Marks the frame permanently failed; the registry sweep removes it. */
  public synchronized void markFailed() {
    failed = true;
  }

  public synchronized Optional<GeoReference> geoReference() {
    return Optional.ofNullable(geoReference);
  }

  /**
   * Attaches navigation parameters received alongside this frame's segments.
   *
   * @param reference geo reference for this frame
   */
  public synchronized void attachGeoReference(GeoReference reference) {
    this.geoReference = Objects.requireNonNull(reference, "reference");
  }

  public FrameKey key() {
    return key;
  }

  public Instant created() {
    return Instant.ofEpochMilli(createdMillis);
  }

  public long createdMillis() {
    return createdMillis;
  }

  public ChannelAggregator visible() {
    return visible;
  }

  public ChannelAggregator infrared() {
    return infrared;
  }

  public ChannelAggregator waterVapour() {
    return waterVapour;
  }

  /**
   * Returns a snapshot of the auxiliary channels keyed by name.
   *
   * @return unmodifiable copy of the auxiliary channel map
   */
  public synchronized Map<String, ChannelAggregator> otherChannels() {
    return Map.copyOf(otherChannels);
  }

  /**
   * Looks up a channel by key without creating it.
   *
   * @param channelKey fixed channel alias or auxiliary channel name
   * @return channel if present
   */
  public synchronized Optional<ChannelAggregator> channel(String channelKey) {
    Optional<ChannelKind> kind = ChannelKind.fromKey(channelKey);
    if (kind.isPresent()) {
      return Optional.of(fixedChannel(kind.get()));
    }
    return channelKey == null ? Optional.empty() : Optional.ofNullable(otherChannels.get(channelKey.trim()));
  }

  public synchronized CompletenessSummary summary() {
    List<ChannelProgress> others = new ArrayList<>(otherChannels.size());
    otherChannels.forEach((name, channel) -> others.add(channel.progress(name)));
    return new CompletenessSummary(
        visible.progress(ChannelKind.VISIBLE.name()),
        infrared.progress(ChannelKind.INFRARED.name()),
        waterVapour.progress(ChannelKind.WATER_VAPOUR.name()),
        others);
  }

  public synchronized boolean hasData() {
    return summary().hasData();
  }

  /**
   * Derives the lifecycle state at {@code nowMillis}.
   *
   * @param nowMillis epoch milliseconds used for the timeout check
   * @return current state
   */
  public synchronized FrameState state(long nowMillis) {
    if (failed) {
      return FrameState.FAILED;
    }
    if (isComplete()) {
      return isProcessed() ? FrameState.CONSUMED : FrameState.COMPLETE;
    }
    if (timedOut(nowMillis)) {
      return FrameState.TIMED_OUT;
    }
    return hasData() ? FrameState.ACCUMULATING : FrameState.EMPTY;
  }

  public FrameState state() {
    return state(clock.getAsLong());
  }

  /**
   * Claims the right to publish this frame's completion. Succeeds once per group; afterwards the frame
   * rejects further segments and descriptors.
   *
   * @return {@code true} for the first caller only
   */
  public synchronized boolean claimCompletion() {
    if (completionClaimed) {
      return false;
    }
    completionClaimed = true;
    return true;
  }

  public synchronized boolean completionClaimed() {
    return completionClaimed;
  }

  /** Marks the group as removed from its registry; writers holding a stale reference must re-resolve. */
  public synchronized void retire() {
    retired = true;
  }

  public synchronized boolean isRetired() {
    return retired;
  }

  @Override
  public synchronized String toString() {
    return "Satellite Name: " + key.satelliteName() + "\n"
        + "Region Name: " + key.regionName() + "\n"
        + "Frame Time: " + key.frameTime() + "\n"
        + "Visible Segments: " + describe(visible) + "\n"
        + "Infrared Segments: " + describe(infrared) + "\n"
        + "Water Vapour Segments: " + describe(waterVapour) + "\n"
        + "Other Data " + otherChannels.size() + " (" + (otherDataIsComplete() ? "Complete" : "Incomplete") + ")\n";
  }

  private static String describe(ChannelAggregator channel) {
    return channel.receivedCount() + " (" + (channel.isComplete() ? "Complete" : "Incomplete") + ")";
  }
}

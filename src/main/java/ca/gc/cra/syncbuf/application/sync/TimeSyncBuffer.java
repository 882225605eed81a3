package ca.gc.cra.syncbuf.application.sync;

import ca.gc.cra.syncbuf.application.port.ClockPort;
import ca.gc.cra.syncbuf.application.port.MetricsPort;
import ca.gc.cra.syncbuf.config.BufferConfig;
import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import ca.gc.cra.syncbuf.domain.buffer.Entry;
import ca.gc.cra.syncbuf.domain.buffer.MissingTransformException;
import ca.gc.cra.syncbuf.domain.buffer.Transform;
import ca.gc.cra.syncbuf.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.syncbuf.logging.Logs;
import ca.gc.cra.syncbuf.validation.Numbers;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Thread-safe, multi-channel buffer that pairs values from independent producers by time.
 * <p><strong>Why:</strong> Sensors and producers publish at different rates; consumers need the value of every
 * channel closest to one instant, or the freshest value of every channel that is not lagging behind the others.</p>
 * <p><strong>Role:</strong> Application facade owning the channel registry, synchronization core, and insertion
 * worker.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept writes without blocking; conversion and insertion run later on a single serial worker.</li>
 *   <li>Answer oldest-entry, recency, and nearest-timestamp queries across all or some channels.</li>
 *   <li>Drain, then release storage on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All public methods are safe to call from any thread. Writes to one channel
 * become visible in submission order; a read never observes a partially applied insert.</p>
 * <p><strong>Observability:</strong> Emits {@code buffer.put.*}, {@code buffer.insert.*}, {@code buffer.read.*},
 * {@code buffer.transform.failed}, and {@code buffer.close.*} metrics; dropped jobs are logged at WARN.</p>
 *
 * @since 0.1.0
 */
public final class TimeSyncBuffer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TimeSyncBuffer.class);
  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private final BufferConfig config;
  private final ChannelRegistry registry;
  private final SyncCore core;
  private final ThreadPoolExecutor worker;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Object closeLock = new Object();
  private volatile boolean closed;
  private boolean released;

  /**
   * Creates a buffer over the given channels; a channel's index is its position in {@code channels}.
   *
   * @param config capacity and lifecycle settings
   * @param clock monotonic clock stamping write times for recency queries
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   * @param channels ordered channel declarations; at least one, no duplicates
   * @throws ca.gc.cra.syncbuf.domain.buffer.BufferConfigurationException when the channel list is empty or
   *     contains duplicates
   */
  public TimeSyncBuffer(
      BufferConfig config, ClockPort clock, MetricsPort metrics, List<? extends ChannelSpec<?, ?>> channels) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.registry = new ChannelRegistry(channels);
    this.core = new SyncCore(registry.size(), config.capacity(), clock, this.metrics);
    this.worker = ExecutorFactories.newSerialWorker(
        config.workerThreadName(),
        (thread, ex) -> log.error("Uncaught exception in buffer worker {}", thread.getName(), ex));
    log.info("Time sync buffer created with {} channels (capacity {} per channel)",
        registry.size(), config.capacity());
  }

  /**
   * Creates a buffer with default settings except for the per-channel capacity.
   *
   * @param capacity entries retained per channel
   * @param channels ordered channel declarations
   * @return new buffer using the system clock and no metrics
   */
  public static TimeSyncBuffer of(int capacity, ChannelSpec<?, ?>... channels) {
    return new TimeSyncBuffer(
        BufferConfig.defaults().withCapacity(capacity), ClockPort.SYSTEM, MetricsPort.NO_OP, Arrays.asList(channels));
  }

  /**
   * Creates a buffer with default settings.
   *
   * @param channels ordered channel declarations
   * @return new buffer using the system clock and no metrics
   */
  public static TimeSyncBuffer create(ChannelSpec<?, ?>... channels) {
    return of(BufferConfig.DEFAULT_CAPACITY, channels);
  }

  /**
   * Schedules a write using the channel's implicit conversion or default transform.
   *
   * @see #put(ChannelSpec, Object, long, Transform)
   */
  public <I, O> boolean put(ChannelSpec<I, O> channel, I value, long timestamp) {
    return put(channel, value, timestamp, null);
  }

  /**
   * Schedules conversion of {@code value} and its insertion into {@code channel}; never blocks.
   *
   * <p>The transform is used only when the channel's types require one; channels with an implicit or
   * element-wise conversion ignore it. A transform that throws or returns {@code null} drops the job.</p>
   *
   * @param channel target channel declared on this buffer
   * @param value producer value
   * @param timestamp caller-defined timestamp stored with the entry
   * @param transform per-call conversion; may be {@code null}
   * @return {@code true} when the job was scheduled, {@code false} when the buffer is closed
   * @throws MissingTransformException when the channel needs a transform and none is available
   * @throws IllegalArgumentException when the channel does not belong to this buffer
   */
  public <I, O> boolean put(ChannelSpec<I, O> channel, I value, long timestamp, Transform<I, O> transform) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(value, "value");
    int index = registry.indexOf(channel);
    Transform<I, O> resolved = TransformStage.resolve(channel, transform);
    return schedule(index, channel.name(), () -> resolved.apply(value), timestamp);
  }

  /**
   * Index-addressed write for callers that do not hold typed channel references.
   *
   * @param index channel index in declaration order
   * @param value producer value; its runtime type must match the channel's input type
   * @param timestamp caller-defined timestamp
   * @return {@code true} when the job was scheduled, {@code false} when the buffer is closed
   * @throws IndexOutOfBoundsException when {@code index} is not a channel index
   * @throws IllegalArgumentException when {@code value} has the wrong type
   * @throws MissingTransformException when the channel needs a transform and has no default
   */
  public boolean put(int index, Object value, long timestamp) {
    Objects.requireNonNull(value, "value");
    ChannelSpec<?, ?> channel = registry.get(index);
    if (!channel.inputType().isInstance(value)) {
      throw new IllegalArgumentException("channel '" + channel.name() + "' expects "
          + channel.inputType().getName() + " but got " + value.getClass().getName());
    }
    return putUnchecked(channel, value, timestamp);
  }

  private <I, O> boolean putUnchecked(ChannelSpec<I, O> channel, Object value, long timestamp) {
    @SuppressWarnings("unchecked")
    I input = (I) value;
    return put(channel, input, timestamp, null);
  }

  private boolean schedule(int index, String channelName, Callable<Object> conversion, long timestamp) {
    if (closed) {
      metrics.increment("buffer.put.rejected");
      log.debug("Rejected write to channel {} after close", channelName);
      return false;
    }
    long submittedAt = clock.nanoTime();
    try {
      worker.execute(() -> insert(index, channelName, conversion, timestamp, submittedAt));
    } catch (RejectedExecutionException ex) {
      metrics.increment("buffer.put.rejected");
      log.debug("Worker refused write to channel {}", channelName);
      return false;
    }
    metrics.increment("buffer.put.scheduled");
    return true;
  }

  private void insert(int index, String channelName, Callable<Object> conversion, long timestamp, long submittedAt) {
    Object output;
    try {
      output = conversion.call();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("buffer.transform.failed");
      log.warn("Conversion for channel {} interrupted; entry at {} dropped", channelName, timestamp);
      return;
    } catch (Exception ex) {
      metrics.increment("buffer.transform.failed");
      log.warn("Conversion for channel {} failed; entry at {} dropped", channelName, timestamp, ex);
      return;
    }
    if (output == null) {
      metrics.increment("buffer.transform.failed");
      log.warn("Conversion for channel {} returned null; entry at {} dropped", channelName, timestamp);
      return;
    }
    switch (core.insert(index, output, timestamp)) {
      case APPLIED -> metrics.increment("buffer.insert.applied");
      case EVICTED -> {
        metrics.increment("buffer.insert.applied");
        metrics.increment("buffer.insert.evicted");
      }
      case DISCARDED -> {
        metrics.increment("buffer.insert.discarded");
        log.debug("Discarded entry for channel {} after storage release", channelName);
        return;
      }
    }
    metrics.observe("buffer.insert.latencyNanos", clock.nanoTime() - submittedAt);
    if (log.isTraceEnabled()) {
      log.trace("Inserted entry into channel {} at {}", channelName, timestamp);
    }
  }

  /**
   * Waits until every write scheduled before this call has been inserted or dropped.
   *
   * @param timeout maximum time to wait
   * @return {@code true} when drained, {@code false} on timeout
   * @throws InterruptedException when interrupted while waiting
   */
  public boolean flush(Duration timeout) throws InterruptedException {
    Numbers.requireNonNegative("timeout", timeout);
    long nanos = toNanos(timeout);
    CountDownLatch barrier = new CountDownLatch(1);
    try {
      worker.execute(barrier::countDown);
    } catch (RejectedExecutionException ex) {
      return worker.awaitTermination(nanos, TimeUnit.NANOSECONDS);
    }
    return barrier.await(nanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Approximate number of writes waiting for the worker.
   *
   * @return queued job count
   */
  public int pendingJobs() {
    return worker.getQueue().size();
  }

  /** Oldest retained entry of every channel. */
  public SyncSnapshot readFirst() {
    return readFirst(registry.allIndices());
  }

  /** Oldest retained entry of each selected channel. */
  public SyncSnapshot readFirst(Collection<? extends ChannelSpec<?, ?>> channels) {
    return readFirst(registry.indicesOf(channels));
  }

  /** Oldest retained entry of one channel. */
  public <O> Optional<O> readFirst(ChannelSpec<?, O> channel) {
    return readFirst(List.of(channel)).get(channel);
  }

  private SyncSnapshot readFirst(int[] indices) {
    metrics.increment("buffer.read.first");
    return snapshot(indices, core.readFirst(indices));
  }

  /**
   * Most recently inserted entry of every non-empty channel, without a staleness bound.
   *
   * @return snapshot over all channels
   */
  public SyncSnapshot readLast() {
    return readLast(registry.allIndices(), SyncCore.UNBOUNDED);
  }

  /**
   * Most recently inserted entry of every channel whose last write happened less than {@code maxDiff} before
   * the most recent write to any channel.
   *
   * @param maxDiff recency tolerance measured on the buffer's monotonic clock
   * @return snapshot over all channels
   * @throws IllegalArgumentException when {@code maxDiff} is negative
   */
  public SyncSnapshot readLast(Duration maxDiff) {
    return readLast(registry.allIndices(), recencyNanos(maxDiff));
  }

  /**
   * Recency query restricted to {@code channels}; the reference write time still spans every channel.
   *
   * @param maxDiff recency tolerance
   * @param channels selected channels
   * @return snapshot over the selected channels
   */
  public SyncSnapshot readLast(Duration maxDiff, Collection<? extends ChannelSpec<?, ?>> channels) {
    return readLast(registry.indicesOf(channels), recencyNanos(maxDiff));
  }

  /** Recency query for one channel. */
  public <O> Optional<O> readLast(ChannelSpec<?, O> channel, Duration maxDiff) {
    return readLast(maxDiff, List.of(channel)).get(channel);
  }

  private SyncSnapshot readLast(int[] indices, long maxDiffNanos) {
    metrics.increment("buffer.read.last");
    return snapshot(indices, core.readLast(indices, maxDiffNanos));
  }

  /**
   * Entry of every channel whose timestamp is nearest to {@code timestamp}, without a tolerance.
   *
   * @param timestamp query timestamp in the producers' unit
   * @return snapshot over all channels
   */
  public SyncSnapshot read(long timestamp) {
    return read(timestamp, Long.MAX_VALUE);
  }

  /**
   * Entry of every channel whose timestamp is nearest to {@code timestamp}, accepted only when it is at most
   * {@code maxDiff} older than the query. Entries newer than the query are always accepted. Ties go to the
   * older entry.
   *
   * @param timestamp query timestamp in the producers' unit
   * @param maxDiff staleness tolerance in the same unit; {@link Long#MAX_VALUE} disables it
   * @return snapshot over all channels
   * @throws IllegalArgumentException when {@code maxDiff} is negative
   */
  public SyncSnapshot read(long timestamp, long maxDiff) {
    return read(registry.allIndices(), timestamp, maxDiff);
  }

  /** Nearest-timestamp query restricted to {@code channels}. */
  public SyncSnapshot read(long timestamp, long maxDiff, Collection<? extends ChannelSpec<?, ?>> channels) {
    return read(registry.indicesOf(channels), timestamp, maxDiff);
  }

  /** Nearest-timestamp query for one channel. */
  public <O> Optional<O> read(ChannelSpec<?, O> channel, long timestamp, long maxDiff) {
    return read(timestamp, maxDiff, List.of(channel)).get(channel);
  }

  private SyncSnapshot read(int[] indices, long timestamp, long maxDiff) {
    Numbers.requireNonNegative("maxDiff", maxDiff);
    metrics.increment("buffer.read.nearest");
    return snapshot(indices, core.readNearest(indices, timestamp, maxDiff));
  }

  /**
   * Renders every channel's retained entries, oldest first. Not a stable format.
   *
   * @return multi-line description of the buffer contents
   */
  public String dump() {
    List<List<Entry<Object>>> contents = core.copyEntries();
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < contents.size(); i++) {
      List<Entry<Object>> entries = contents.get(i);
      out.append("channel ").append(i).append(" '").append(registry.get(i).name()).append("' (")
          .append(entries.size()).append('/').append(config.capacity()).append(")\n");
      for (int j = 0; j < entries.size(); j++) {
        Entry<Object> entry = entries.get(j);
        out.append("  [").append(j).append("] ")
            .append(Logs.truncate(String.valueOf(entry.value()), config.dumpValueBytes()))
            .append(" @ ").append(entry.timestamp()).append('\n');
      }
    }
    return out.toString();
  }

  /** Writes {@link #dump()} to the log at DEBUG. */
  public void logContents() {
    if (log.isDebugEnabled()) {
      log.debug("Buffer contents:\n{}", dump());
    }
  }

  /** Declared channels in index order. */
  public List<ChannelSpec<?, ?>> channels() {
    return registry.channels();
  }

  public BufferConfig config() {
    return config;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops accepting writes, drains queued writes for up to the configured drain timeout, cancels whatever is
   * left, then releases channel storage. Idempotent.
   *
   * <p>No insert lands after this method returns, even when a conversion outlives the drain. An interrupt
   * while draining cancels the remaining writes and is re-asserted on the calling thread.</p>
   */
  @Override
  public void close() {
    synchronized (closeLock) {
      if (released) {
        return;
      }
      closed = true;
      worker.shutdown();
      long drainMillis = config.drainTimeout().toMillis();
      try {
        if (!worker.awaitTermination(drainMillis, TimeUnit.MILLISECONDS)) {
          metrics.increment("buffer.close.forced");
          int cancelled = worker.shutdownNow().size();
          log.warn("Buffer worker still busy after {} ms; cancelled {} queued writes", drainMillis, cancelled);
        }
      } catch (InterruptedException ie) {
        metrics.increment("buffer.close.interrupted");
        int cancelled = worker.shutdownNow().size();
        log.warn("Interrupted while draining buffer worker; cancelled {} queued writes", cancelled);
        Thread.currentThread().interrupt();
      }
      core.release();
      released = true;
      log.info("Time sync buffer closed ({} channels)", registry.size());
    }
  }

  private SyncSnapshot snapshot(int[] indices, List<Optional<Object>> values) {
    return new SyncSnapshot(registry.channels(), indices, values);
  }

  private static long recencyNanos(Duration maxDiff) {
    Numbers.requireNonNegative("maxDiff", maxDiff);
    return toNanos(maxDiff);
  }

  private static long toNanos(Duration duration) {
    return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
  }
}

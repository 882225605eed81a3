package ca.gc.cra.syncbuf.application.sync;

import ca.gc.cra.syncbuf.application.port.ClockPort;
import ca.gc.cra.syncbuf.application.port.MetricsPort;
import ca.gc.cra.syncbuf.domain.buffer.ChannelStore;
import ca.gc.cra.syncbuf.domain.buffer.Entry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Shared state coordinating the write and read paths of one buffer.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own every channel store and the per-channel last-write ticks.</li>
 *   <li>Guard all of them with one read/write lock spanning every channel.</li>
 *   <li>Maintain the approximate "any data present" hint used to skip locking on empty buffers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Writes take the exclusive lock; queries take the shared lock. A single
 * lock across channels keeps the cross-channel recency comparison in {@link #readLast} consistent, so it must
 * not be split per channel.</p>
 */
final class SyncCore {
  /** Marks a channel that has never been written. */
  static final long NEVER_WRITTEN = Long.MIN_VALUE;
  /** Tolerance that disables the staleness check. */
  static final long UNBOUNDED = Long.MAX_VALUE;

  private final List<ChannelStore<Object>> stores;
  private final long[] lastWrite;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final ClockPort clock;
  private final MetricsPort metrics;
  private volatile boolean hasAnyData;
  private boolean released;

  SyncCore(int channelCount, int capacity, ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    List<ChannelStore<Object>> created = new ArrayList<>(channelCount);
    for (int i = 0; i < channelCount; i++) {
      created.add(new ChannelStore<>(capacity));
    }
    this.stores = List.copyOf(created);
    this.lastWrite = new long[channelCount];
    Arrays.fill(lastWrite, NEVER_WRITTEN);
  }

  /** Result of one insert attempt. */
  enum InsertOutcome {
    /** Appended without eviction. */
    APPLIED,
    /** Appended after evicting the oldest entry. */
    EVICTED,
    /** Storage already released; nothing was written. */
    DISCARDED
  }

  InsertOutcome insert(int index, Object value, long timestamp) {
    lock.writeLock().lock();
    try {
      if (released) {
        return InsertOutcome.DISCARDED;
      }
      lastWrite[index] = clock.nanoTime();
      boolean evicted = stores.get(index).insert(value, timestamp);
      hasAnyData = true;
      return evicted ? InsertOutcome.EVICTED : InsertOutcome.APPLIED;
    } finally {
      lock.writeLock().unlock();
    }
  }

  List<Optional<Object>> readFirst(int[] indices) {
    return scan(indices, () -> (index, store) -> store.front());
  }

  List<Optional<Object>> readLast(int[] indices, long maxDiffNanos) {
    return scan(indices, () -> {
      long newest = newestWrite();
      return (index, store) -> {
        if (store.isEmpty()) {
          return Optional.empty();
        }
        if (maxDiffNanos != UNBOUNDED && newest - lastWrite[index] >= maxDiffNanos) {
          return Optional.empty();
        }
        return store.back();
      };
    });
  }

  List<Optional<Object>> readNearest(int[] indices, long query, long maxDiff) {
    return scan(indices, () -> (index, store) ->
        store.nearest(query).filter(entry -> entry.ageAt(query) <= maxDiff));
  }

  long lastWrite(int index) {
    lock.readLock().lock();
    try {
      return lastWrite[index];
    } finally {
      lock.readLock().unlock();
    }
  }

  List<List<Entry<Object>>> copyEntries() {
    lock.readLock().lock();
    try {
      List<List<Entry<Object>>> copy = new ArrayList<>(stores.size());
      for (ChannelStore<Object> store : stores) {
        copy.add(store.entries());
      }
      return copy;
    } finally {
      lock.readLock().unlock();
    }
  }

  boolean hasAnyData() {
    return hasAnyData;
  }

  void release() {
    lock.writeLock().lock();
    try {
      released = true;
      for (ChannelStore<Object> store : stores) {
        store.clear();
      }
      hasAnyData = false;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private List<Optional<Object>> scan(int[] indices, Supplier<Selector> selectorFactory) {
    List<Optional<Object>> results = new ArrayList<>(indices.length);
    if (!hasAnyData) {
      metrics.increment("buffer.read.fastPath");
      for (int i = 0; i < indices.length; i++) {
        results.add(Optional.empty());
      }
      return results;
    }
    lock.readLock().lock();
    try {
      Selector selector = selectorFactory.get();
      for (int index : indices) {
        results.add(selector.select(index, stores.get(index)).map(Entry::value));
      }
      if (allEmpty()) {
        hasAnyData = false;
      }
      return results;
    } finally {
      lock.readLock().unlock();
    }
  }

  private long newestWrite() {
    long newest = NEVER_WRITTEN;
    for (long tick : lastWrite) {
      newest = Math.max(newest, tick);
    }
    return newest;
  }

  private boolean allEmpty() {
    for (ChannelStore<Object> store : stores) {
      if (!store.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @FunctionalInterface
  private interface Selector {
    Optional<Entry<Object>> select(int index, ChannelStore<Object> store);
  }
}

package ca.gc.cra.syncbuf.domain.buffer;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Bounded oldest-first sequence of {@link Entry} values for one channel.
 * <p><strong>Why:</strong> Keeps each channel's memory independent while the owning buffer supplies the
 * locking.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append at the tail, evicting the head first when the store is full (pure insertion-order FIFO).</li>
 *   <li>Expose the oldest and newest entries without removing them.</li>
 *   <li>Locate the entry nearest a timestamp by linear scan.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Every call must run under the owner's lock.</p>
 * <p><strong>Performance:</strong> O(1) insert/front/back; O(capacity) nearest scan.</p>
 *
 * @param <O> channel output type
 * @since 0.1.0
 */
public final class ChannelStore<O> {
  private final int capacity;
  private final ArrayDeque<Entry<O>> entries;

  /**
   * Creates an empty store.
   *
   * @param capacity maximum retained entries; must be positive
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public ChannelStore(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(Math.min(capacity, 1_024));
  }

  /**
   * Appends an entry, evicting the oldest entry first when the store is at capacity.
   *
   * @param value converted value; must not be {@code null}
   * @param timestamp caller-supplied timestamp
   * @return {@code true} when an older entry was evicted to make room
   */
  public boolean insert(O value, long timestamp) {
    Entry<O> entry = new Entry<>(value, timestamp);
    boolean evicted = false;
    if (entries.size() + 1 > capacity) {
      entries.pollFirst();
      evicted = true;
    }
    entries.addLast(entry);
    return evicted;
  }

  /**
   * Returns the oldest retained entry.
   *
   * @return oldest entry, or empty when the store holds nothing
   */
  public Optional<Entry<O>> front() {
    return Optional.ofNullable(entries.peekFirst());
  }

  /**
   * Returns the newest retained entry.
   *
   * @return newest entry, or empty when the store holds nothing
   */
  public Optional<Entry<O>> back() {
    return Optional.ofNullable(entries.peekLast());
  }

  /**
   * Finds the entry whose timestamp minimizes {@code |timestamp - query|}.
   *
   * <p>Timestamps need not be monotonic. On equal distance the earlier inserted entry wins.</p>
   *
   * @param query reference timestamp
   * @return nearest entry, or empty when the store holds nothing
   */
  public Optional<Entry<O>> nearest(long query) {
    Entry<O> best = null;
    long bestDistance = Long.MAX_VALUE;
    for (Entry<O> candidate : entries) {
      long distance = candidate.distanceTo(query);
      if (best == null || distance < bestDistance) {
        best = candidate;
        bestDistance = distance;
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Indicates whether the store holds no entries.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Returns the number of retained entries.
   *
   * @return current size, never greater than {@link #capacity()}
   */
  public int size() {
    return entries.size();
  }

  /**
   * Returns the configured capacity.
   *
   * @return maximum retained entries
   */
  public int capacity() {
    return capacity;
  }

  /**
   * Copies the retained entries oldest-first.
   *
   * @return immutable snapshot of the entries
   */
  public List<Entry<O>> entries() {
    return List.copyOf(entries);
  }

  /** Drops every retained entry. */
  public void clear() {
    entries.clear();
  }
}

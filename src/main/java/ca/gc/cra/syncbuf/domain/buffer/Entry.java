package ca.gc.cra.syncbuf.domain.buffer;

import java.util.Objects;

/**
 * Value retained by a channel together with the caller-supplied timestamp.
 *
 * <p>The timestamp unit is defined by the producer (commonly epoch milliseconds); the buffer only
 * compares distances between timestamps and never interprets them.</p>
 *
 * @param value converted output value; never {@code null}
 * @param timestamp caller-defined timestamp used for nearest-match queries
 * @param <O> channel output type
 * @since 0.1.0
 */
public record Entry<O>(O value, long timestamp) {
  /**
   * Validates the entry components.
   *
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public Entry {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Signed distance from this entry to {@code query}, computed as {@code query - timestamp}.
   *
   * <p>Saturates at {@link Long#MIN_VALUE}/{@link Long#MAX_VALUE} instead of overflowing.</p>
   *
   * @param query reference timestamp in the caller's unit
   * @return positive when the entry is older than the query, negative when newer
   */
  public long ageAt(long query) {
    long diff = query - timestamp;
    if (((query ^ timestamp) & (query ^ diff)) < 0) {
      return query < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
    return diff;
  }

  /**
   * Absolute distance between this entry and {@code query}, saturating at {@link Long#MAX_VALUE}.
   *
   * @param query reference timestamp in the caller's unit
   * @return non-negative distance
   */
  public long distanceTo(long query) {
    long age = ageAt(query);
    return age == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(age);
  }
}

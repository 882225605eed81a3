package ca.gc.cra.syncbuf.infrastructure.time;

import ca.gc.cra.syncbuf.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the current monotonic tick.
   *
   * @return nanoseconds from an arbitrary origin
   * @implNote Delegates to {@link System#nanoTime()} without smoothing.
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}

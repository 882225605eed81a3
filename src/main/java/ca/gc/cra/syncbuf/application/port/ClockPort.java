package ca.gc.cra.syncbuf.application.port;

/**
 * <strong>What:</strong> Port supplying the monotonic time used to stamp channel writes.
 * <p><strong>Why:</strong> Recency queries compare when channels were last written, independently of the
 * payload timestamps producers supply; tests inject deterministic clocks.</p>
 * <p><strong>Role:</strong> Application port consumed by the synchronization core.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose a non-decreasing tick count in nanoseconds.</li>
 *   <li>Allow adapters to inject deterministic clocks for testing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the buffer worker reads the clock
 * while consumers run queries.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()}.
 * @since 0.1.0
 * @see ca.gc.cra.syncbuf.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current monotonic tick in nanoseconds.
   *
   * @return nanoseconds from an arbitrary origin; only differences between readings are meaningful
   *
   * <p><strong>Concurrency:</strong> Must be safe for concurrent invocations.</p>
   */
  long nanoTime();

  /**
   * Default {@link ClockPort} using {@link System#nanoTime()}.
   */
  ClockPort SYSTEM = System::nanoTime;
}

package ca.gc.cra.syncbuf.application.sync;

import ca.gc.cra.syncbuf.application.port.ClockPort;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that only moves when told to.
 */
final class ManualClock implements ClockPort {
  private final AtomicLong now = new AtomicLong();

  @Override
  public long nanoTime() {
    return now.get();
  }

  void advance(Duration delta) {
    now.addAndGet(delta.toNanos());
  }

  void set(long nanos) {
    now.set(nanos);
  }
}

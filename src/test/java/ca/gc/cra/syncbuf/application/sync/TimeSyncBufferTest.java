package ca.gc.cra.syncbuf.application.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.syncbuf.application.port.ClockPort;
import ca.gc.cra.syncbuf.config.BufferConfig;
import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import ca.gc.cra.syncbuf.domain.buffer.MissingTransformException;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TimeSyncBufferTest {
  private static final Duration FLUSH = Duration.ofSeconds(5);

  private final ChannelSpec<Integer, Float> counter = ChannelSpec.of("counter", Integer.class, Float.class);
  private final ChannelSpec<String, String> label = ChannelSpec.identity("label", String.class);
  private final ChannelSpec<Integer, String> hex =
      ChannelSpec.of("hex", Integer.class, String.class, Integer::toHexString);

  private ManualClock clock;
  private RecordingMetricsPort metrics;
  private TimeSyncBuffer buffer;

  @BeforeEach
  void setUp() {
    clock = new ManualClock();
    metrics = new RecordingMetricsPort();
    buffer = newBuffer(BufferConfig.defaults().withCapacity(3), clock);
  }

  @AfterEach
  void tearDown() {
    buffer.close();
  }

  private TimeSyncBuffer newBuffer(BufferConfig config, ClockPort clockPort) {
    return new TimeSyncBuffer(config, clockPort, metrics, List.of(counter, label, hex));
  }

  @Test
  void writeThenReadAtSameTimestampRoundTrips() throws Exception {
    assertTrue(buffer.put(counter, 12, 1_000L));
    assertTrue(buffer.flush(FLUSH));

    assertEquals(Optional.of(12.0f), buffer.read(counter, 1_000L, 0));
    assertEquals(1, metrics.count("buffer.insert.applied"));
    assertEquals(1, metrics.observed("buffer.insert.latencyNanos").size());
  }

  @Test
  void oldestEntryIsEvictedOnceCapacityIsExceeded() throws Exception {
    for (int i = 1; i <= 4; i++) {
      buffer.put(label, "v" + i, i);
    }
    buffer.flush(FLUSH);

    assertEquals(Optional.of("v2"), buffer.readFirst(label));
    assertEquals(Optional.of("v4"), buffer.readLast(label, Duration.ofDays(1)));
    assertEquals(1, metrics.count("buffer.insert.evicted"));
    assertEquals(4, metrics.count("buffer.insert.applied"));
  }

  @Test
  void nearestReadRespectsTolerance() throws Exception {
    buffer.put(label, "ten", 10);
    buffer.put(label, "fifty", 50);
    buffer.put(label, "ninety", 90);
    buffer.flush(FLUSH);

    assertEquals(Optional.of("fifty"), buffer.read(52).get(label));
    assertEquals(Optional.empty(), buffer.read(52, 1).get(label));
    assertEquals(Optional.of("fifty"), buffer.read(label, 52, 2));
    assertEquals(Optional.of("fifty"), buffer.read(label, 70, 20));
  }

  @Test
  void entriesNewerThanQueryAreAlwaysAccepted() throws Exception {
    buffer.put(label, "future", 100);
    buffer.flush(FLUSH);

    assertEquals(Optional.of("future"), buffer.read(label, 40, 0));
  }

  @Test
  void readLastWithoutToleranceReturnsEveryNonEmptyChannel() throws Exception {
    buffer.put(counter, 1, 0);
    buffer.flush(FLUSH);
    clock.advance(Duration.ofHours(1));
    buffer.put(label, "late", 0);
    buffer.flush(FLUSH);

    SyncSnapshot all = buffer.readLast();
    assertEquals(Optional.of(1.0f), all.get(counter));
    assertEquals(Optional.of("late"), all.get(label));
    assertEquals(Optional.empty(), all.get(hex));

    SyncSnapshot recent = buffer.readLast(Duration.ofSeconds(1));
    assertEquals(Optional.empty(), recent.get(counter));
    assertEquals(Optional.of("late"), recent.get(label));
  }

  @Test
  void readLastOnSubsetStillComparesWithEveryChannel() throws Exception {
    buffer.put(counter, 1, 0);
    buffer.flush(FLUSH);
    clock.advance(Duration.ofMillis(200));
    buffer.put(label, "newer", 0);
    buffer.flush(FLUSH);

    assertEquals(Optional.empty(), buffer.readLast(counter, Duration.ofMillis(100)));
    assertEquals(Optional.of(1.0f), buffer.readLast(counter, Duration.ofMillis(201)));
  }

  @Test
  void subsetReadsOnlyIncludeSelectedChannels() throws Exception {
    buffer.put(counter, 5, 5);
    buffer.put(label, "five", 5);
    buffer.flush(FLUSH);

    SyncSnapshot snapshot = buffer.readFirst(List.of(label));

    assertEquals(1, snapshot.selectedCount());
    assertEquals(Optional.of("five"), snapshot.get(label));
    assertThrows(IllegalArgumentException.class, () -> snapshot.get(counter));
  }

  @Test
  void negativeTolerancesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> buffer.read(1, -1));
    assertThrows(IllegalArgumentException.class, () -> buffer.readLast(Duration.ofMillis(-1)));
  }

  @Test
  void foreignChannelIsRejected() {
    ChannelSpec<String, String> stranger = ChannelSpec.identity("label", String.class);

    assertThrows(IllegalArgumentException.class, () -> buffer.put(stranger, "x", 1));
    assertThrows(IllegalArgumentException.class, () -> buffer.readFirst(stranger));
  }

  @Test
  void channelWithoutTransformFailsAtCallSite() {
    ChannelSpec<Integer, String> bare = ChannelSpec.of("bare", Integer.class, String.class);
    try (TimeSyncBuffer local = TimeSyncBuffer.of(2, bare)) {
      MissingTransformException ex = assertThrows(MissingTransformException.class, () -> local.put(bare, 1, 1));
      assertEquals("bare", ex.channel());
      assertTrue(local.put(bare, 1, 1, v -> "n" + v));
    }
  }

  @Test
  void perCallTransformOverridesDefault() throws Exception {
    buffer.put(hex, 255, 1);
    buffer.put(hex, 255, 2, v -> "#" + v);
    buffer.flush(FLUSH);

    assertEquals(Optional.of("ff"), buffer.read(hex, 1, 0));
    assertEquals(Optional.of("#255"), buffer.read(hex, 2, 0));
  }

  @Test
  void implicitChannelIgnoresPerCallTransform() throws Exception {
    buffer.put(label, "kept", 1, s -> "replaced");
    buffer.flush(FLUSH);

    assertEquals(Optional.of("kept"), buffer.readFirst(label));
  }

  @Test
  void indexedPutChecksRuntimeType() throws Exception {
    assertThrows(IllegalArgumentException.class, () -> buffer.put(1, 42, 1));
    assertThrows(IndexOutOfBoundsException.class, () -> buffer.put(7, "x", 1));

    assertTrue(buffer.put(1, "indexed", 1));
    buffer.flush(FLUSH);
    assertEquals(Optional.of("indexed"), buffer.readFirst().get(1));
  }

  @Test
  void failedConversionIsDroppedWithoutBlockingLaterWrites() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(TimeSyncBuffer.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      buffer.put(hex, 1, 1, v -> {
        throw new IllegalStateException("boom");
      });
      buffer.put(hex, 2, 2, v -> null);
      buffer.put(hex, 3, 3);
      buffer.flush(FLUSH);

      assertEquals(Optional.of("3"), buffer.readLast(hex, Duration.ofDays(1)));
      assertEquals(Optional.of("3"), buffer.readFirst(hex));
      assertEquals(2, metrics.count("buffer.transform.failed"));
      assertEquals(1, metrics.count("buffer.insert.applied"));
      long warnings = appender.list.stream()
          .filter(event -> event.getLevel() == Level.WARN)
          .filter(event -> event.getFormattedMessage().contains("channel hex"))
          .count();
      assertEquals(2, warnings);
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void dumpListsEntriesPerChannel() throws Exception {
    buffer.put(label, "alpha", 7);
    buffer.put(counter, 2, 8);
    buffer.flush(FLUSH);

    String dump = buffer.dump();

    assertTrue(dump.contains("channel 0 'counter' (1/3)"), dump);
    assertTrue(dump.contains("  [0] 2.0 @ 8"), dump);
    assertTrue(dump.contains("channel 1 'label' (1/3)"), dump);
    assertTrue(dump.contains("  [0] alpha @ 7"), dump);
    assertTrue(dump.contains("channel 2 'hex' (0/3)"), dump);
  }

  @Test
  void emptyBufferReadsAreEmpty() {
    assertTrue(buffer.readFirst().isEmpty());
    assertTrue(buffer.readLast().isEmpty());
    assertTrue(buffer.read(0).isEmpty());
    assertEquals(3, metrics.count("buffer.read.fastPath"));
  }

  @Test
  void closeDrainsQueuedWritesThenReleasesStorage() {
    for (int i = 0; i < 100; i++) {
      buffer.put(label, "v" + i, i);
    }

    buffer.close();
    buffer.close();

    assertTrue(buffer.isClosed());
    assertEquals(100, metrics.count("buffer.insert.applied"));
    assertEquals(0, metrics.count("buffer.close.forced"));
    assertTrue(buffer.readFirst().isEmpty());
    assertTrue(buffer.readLast().isEmpty());
    assertFalse(buffer.put(label, "late", 101));
    assertEquals(1, metrics.count("buffer.put.rejected"));
  }

  @Test
  void closeCancelsWorkThatOutlivesDrainTimeout() throws Exception {
    BufferConfig config = new BufferConfig(3, Duration.ZERO, "syncbuf-forced", 64);
    TimeSyncBuffer impatient = newBuffer(config, clock);
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch gate = new CountDownLatch(1);
    try {
      impatient.put(hex, 1, 1, v -> {
        started.countDown();
        gate.await();
        return "slow";
      });
      impatient.put(label, "queued", 2);
      assertTrue(started.await(5, TimeUnit.SECONDS));

      impatient.close();

      assertEquals(1, metrics.count("buffer.close.forced"));
      assertTrue(impatient.readFirst().isEmpty());
    } finally {
      gate.countDown();
    }
  }

  @Test
  void flushAfterCloseReportsTermination() throws Exception {
    buffer.close();

    assertTrue(buffer.flush(Duration.ofSeconds(1)));
  }

  @Test
  void closeUnderConcurrentWritesLeavesNothingBehind() throws Exception {
    TimeSyncBuffer shared = newBuffer(BufferConfig.defaults(), ClockPort.SYSTEM);
    ExecutorService producers = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int p = 0; p < 4; p++) {
        int offset = p;
        futures.add(producers.submit(() -> {
          for (int i = 0; i < 2_500; i++) {
            if (offset % 2 == 0) {
              shared.put(counter, i, i);
            } else {
              shared.put(label, "s" + i, i);
            }
          }
        }));
      }
      shared.close();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }

      assertTrue(shared.isClosed());
      assertTrue(shared.readFirst().isEmpty());
      assertTrue(shared.readLast().isEmpty());
      assertFalse(shared.put(label, "after", 0));
    } finally {
      producers.shutdownNow();
      shared.close();
    }
  }

  @Test
  void readLastAlwaysReturnsTheMostRecentlyWrittenChannel() throws Exception {
    TimeSyncBuffer shared = newBuffer(BufferConfig.defaults(), ClockPort.SYSTEM);
    ExecutorService producers = Executors.newFixedThreadPool(2);
    AtomicBoolean running = new AtomicBoolean(true);
    try {
      shared.put(counter, 0, 0);
      shared.put(label, "seed", 0);
      assertTrue(shared.flush(FLUSH));
      producers.submit(() -> {
        int i = 0;
        while (running.get() && i < 50_000) {
          shared.put(counter, i++, i);
        }
      });
      producers.submit(() -> {
        int i = 0;
        while (running.get() && i < 50_000) {
          shared.put(label, "s" + i++, i);
        }
      });

      for (int i = 0; i < 2_000; i++) {
        SyncSnapshot snapshot = shared.readLast(Duration.ofNanos(1));
        assertTrue(snapshot.presentCount() >= 1, snapshot.toString());
      }
    } finally {
      running.set(false);
      producers.shutdown();
      producers.awaitTermination(5, TimeUnit.SECONDS);
      shared.close();
    }
  }
}

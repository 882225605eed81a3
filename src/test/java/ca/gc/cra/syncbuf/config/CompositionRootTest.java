package ca.gc.cra.syncbuf.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.syncbuf.application.port.ClockPort;
import ca.gc.cra.syncbuf.application.port.MetricsPort;
import ca.gc.cra.syncbuf.application.sync.TimeSyncBuffer;
import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import ca.gc.cra.syncbuf.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.syncbuf.infrastructure.time.SystemClockAdapter;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void noneExporterSelectsNoOpMetrics() {
    CompositionRoot root = new CompositionRoot(BufferConfig.defaults(), "none");

    assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    assertInstanceOf(SystemClockAdapter.class, root.clock());
    assertInstanceOf(NoOpMetricsAdapter.class, new CompositionRoot(BufferConfig.defaults(), (String) null).metrics());
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new CompositionRoot(BufferConfig.defaults(), "zipkin"));
  }

  @Test
  void buffersUseConfiguredCapacity() {
    CompositionRoot root =
        new CompositionRoot(BufferConfig.defaults().withCapacity(4), MetricsPort.NO_OP, ClockPort.SYSTEM);
    ChannelSpec<String, String> channel = ChannelSpec.identity("c", String.class);

    try (TimeSyncBuffer buffer = root.newBuffer(List.of(channel))) {
      assertEquals(4, buffer.config().capacity());
      assertEquals(List.of(channel), buffer.channels());
      assertSame(root.bufferConfig(), buffer.config());
    }
  }
}

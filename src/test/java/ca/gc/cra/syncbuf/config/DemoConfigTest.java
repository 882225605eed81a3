package ca.gc.cra.syncbuf.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.syncbuf.domain.buffer.BufferConfigurationException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DemoConfigTest {

  @Test
  void fromMapParsesMillisecondKeys() {
    DemoConfig config = DemoConfig.fromMap(Map.of(
        "iterations", "3",
        "producerPeriodMs", "0",
        "consumerPeriodMs", "5",
        "maxDiffMs", "40"));

    assertEquals(3, config.iterations());
    assertEquals(Duration.ZERO, config.producerPeriod());
    assertEquals(Duration.ofMillis(5), config.consumerPeriod());
    assertEquals(Duration.ofMillis(40), config.maxDiff());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(BufferConfigurationException.class, () -> DemoConfig.fromMap(Map.of("iterations", "0")));
    assertThrows(BufferConfigurationException.class, () -> DemoConfig.fromMap(Map.of("maxDiffMs", "-5")));
    assertThrows(BufferConfigurationException.class,
        () -> DemoConfig.fromMap(Map.of("producerPeriodMs", "soon")));
  }
}

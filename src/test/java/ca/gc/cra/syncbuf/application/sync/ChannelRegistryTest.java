package ca.gc.cra.syncbuf.application.sync;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.syncbuf.domain.buffer.BufferConfigurationException;
import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChannelRegistryTest {
  private final ChannelSpec<Integer, Integer> ints = ChannelSpec.identity("ints", Integer.class);
  private final ChannelSpec<String, String> text = ChannelSpec.identity("text", String.class);
  private final ChannelSpec<Double, Double> doubles = ChannelSpec.identity("doubles", Double.class);

  @Test
  void indexIsDeclarationPosition() {
    ChannelRegistry registry = new ChannelRegistry(List.of(ints, text, doubles));

    assertEquals(3, registry.size());
    assertEquals(0, registry.indexOf(ints));
    assertEquals(2, registry.indexOf(doubles));
    assertEquals(text, registry.get(1));
    assertArrayEquals(new int[] {0, 1, 2}, registry.allIndices());
  }

  @Test
  void selectionKeepsCallerOrderAndDropsRepeats() {
    ChannelRegistry registry = new ChannelRegistry(List.of(ints, text, doubles));

    assertArrayEquals(new int[] {2, 0}, registry.indicesOf(List.of(doubles, ints, doubles)));
  }

  @Test
  void rejectsEmptyAndDuplicateDeclarations() {
    assertThrows(BufferConfigurationException.class, () -> new ChannelRegistry(List.of()));
    assertThrows(BufferConfigurationException.class, () -> new ChannelRegistry(List.of(ints, ints)));
    assertThrows(BufferConfigurationException.class,
        () -> new ChannelRegistry(List.of(ints, ChannelSpec.identity("ints", Long.class))));
    assertThrows(BufferConfigurationException.class, () -> new ChannelRegistry(Arrays.asList(ints, null)));
  }

  @Test
  void foreignChannelsAreRejected() {
    ChannelRegistry registry = new ChannelRegistry(List.of(ints));
    ChannelSpec<Integer, Integer> lookalike = ChannelSpec.identity("ints", Integer.class);

    assertFalse(registry.contains(lookalike));
    assertTrue(registry.contains(ints));
    assertThrows(IllegalArgumentException.class, () -> registry.indexOf(lookalike));
    assertThrows(IllegalArgumentException.class, () -> registry.indicesOf(List.of()));
    assertThrows(IndexOutOfBoundsException.class, () -> registry.get(1));
  }
}

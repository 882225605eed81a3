package ca.gc.cra.syncbuf.domain.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ChannelSpecTest {

  @Test
  void identityChannelIsTierOne() {
    ChannelSpec<String, String> channel = ChannelSpec.identity("label", String.class);

    assertEquals(ConversionTier.IDENTITY, channel.tier());
    assertEquals("hello", channel.convertImplicitly("hello"));
  }

  @Test
  void wideningChannelIsTierOne() {
    ChannelSpec<Integer, Float> channel = ChannelSpec.of("counter", Integer.class, Float.class);

    assertEquals(ConversionTier.IDENTITY, channel.tier());
    assertEquals(3.0f, channel.convertImplicitly(3));
  }

  @Test
  void unrelatedTypesNeedTransform() {
    ChannelSpec<Integer, String> channel = ChannelSpec.of("text", Integer.class, String.class);

    assertEquals(ConversionTier.TRANSFORM, channel.tier());
    assertTrue(channel.defaultTransform().isEmpty());
  }

  @Test
  void defaultTransformIsCarriedOnCopy() throws Exception {
    ChannelSpec<Integer, String> base = ChannelSpec.of("text", Integer.class, String.class);
    ChannelSpec<Integer, String> withDefault = base.withDefaultTransform(i -> "#" + i);

    assertNotSame(base, withDefault);
    assertEquals("#4", withDefault.defaultTransform().orElseThrow().apply(4));
    assertEquals("text", withDefault.name());
  }

  @Test
  void sameElementListChannelStoresProducerList() {
    ChannelSpec<List<Double>, List<Double>> channel = ChannelSpec.elementWise("scan", Double.class, Double.class);
    List<Double> scan = List.of(1.0, 2.0);

    assertEquals(ConversionTier.IDENTITY, channel.tier());
    assertTrue(channel.isSequence());
    assertSame(scan, channel.convertImplicitly(scan));
  }

  @Test
  void wideningListChannelConvertsEachElement() {
    ChannelSpec<List<Integer>, List<Double>> channel = ChannelSpec.elementWise("scan", Integer.class, Double.class);

    assertEquals(ConversionTier.ELEMENT_WISE, channel.tier());
    List<Double> converted = channel.convertElements(List.of(1, 2, 3));
    assertEquals(List.of(1.0, 2.0, 3.0), converted);
    assertThrows(UnsupportedOperationException.class, () -> converted.add(4.0));
  }

  @Test
  void factoryChannelBuildsRequestedCollection() {
    ChannelSpec<Iterable<Integer>, Set<Long>> channel =
        ChannelSpec.elementWise("ids", Integer.class, Long.class, LinkedHashSet::new);

    Set<Long> converted = channel.convertElements(new ArrayDeque<>(List.of(3, 1, 3)));

    assertInstanceOf(LinkedHashSet.class, converted);
    assertEquals(List.of(3L, 1L), List.copyOf(converted));
  }

  @Test
  void elementConversionRejectsNullElements() {
    ChannelSpec<List<Integer>, List<Long>> channel = ChannelSpec.elementWise("ids", Integer.class, Long.class);
    List<Integer> withNull = new ArrayList<>();
    withNull.add(null);

    assertThrows(IllegalArgumentException.class, () -> channel.convertElements(withNull));
  }

  @Test
  void nonConvertibleElementsNeedTransform() {
    ChannelSpec<List<String>, List<Integer>> channel = ChannelSpec.elementWise("parsed", String.class, Integer.class);

    assertEquals(ConversionTier.TRANSFORM, channel.tier());
  }

  @Test
  void blankNameIsConfigurationError() {
    assertThrows(BufferConfigurationException.class, () -> ChannelSpec.identity("  ", String.class));
    assertThrows(NullPointerException.class, () -> ChannelSpec.identity(null, String.class));
  }

  @Test
  void nameIsTrimmed() {
    assertEquals("label", ChannelSpec.identity(" label ", String.class).name());
  }
}

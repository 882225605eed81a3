package ca.gc.cra.syncbuf.domain.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConversionsTest {

  @Test
  void assignableTypesAreImplicit() {
    assertTrue(Conversions.isImplicit(String.class, String.class));
    assertTrue(Conversions.isImplicit(ArrayList.class, Collection.class));
    assertTrue(Conversions.isImplicit(Integer.class, Number.class));
    assertFalse(Conversions.isImplicit(Number.class, Integer.class));
  }

  @Test
  void primitiveWideningIsImplicit() {
    assertTrue(Conversions.isImplicit(Integer.class, Float.class));
    assertTrue(Conversions.isImplicit(int.class, double.class));
    assertTrue(Conversions.isImplicit(Character.class, Integer.class));
    assertFalse(Conversions.isImplicit(Float.class, Integer.class));
    assertFalse(Conversions.isImplicit(Boolean.class, Integer.class));
    assertFalse(Conversions.isImplicit(String.class, Integer.class));
  }

  @Test
  void convertReturnsSameInstanceWhenAssignable() {
    List<String> value = List.of("a");

    assertSame(value, Conversions.convert(value, List.class));
  }

  @Test
  void convertWidensNumbers() {
    assertEquals(7.0f, Conversions.convert(7, Float.class));
    assertEquals(7L, Conversions.convert(7, Long.class));
    assertEquals(65, Conversions.convert('A', Integer.class));
    assertEquals(1.5d, Conversions.convert(1.5f, double.class));
  }

  @Test
  void convertRejectsNarrowing() {
    assertThrows(IllegalArgumentException.class, () -> Conversions.convert(1.5d, Integer.class));
    assertThrows(IllegalArgumentException.class, () -> Conversions.convert("1", Integer.class));
  }
}

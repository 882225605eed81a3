package ca.gc.cra.syncbuf.domain.buffer;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Implicit conversion rules shared by channel declarations and the transform stage.
 *
 * <p>A value converts implicitly when its type is assignable to the target, or when both are boxed
 * primitives related by a widening primitive conversion (JLS 5.1.2), e.g. {@code Integer} to
 * {@code Float}.</p>
 *
 * @since 0.1.0
 */
public final class Conversions {
  private static final Map<Class<?>, Class<?>> BOXES = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      short.class, Short.class,
      char.class, Character.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class);

  private static final Map<Class<?>, Set<Class<?>>> WIDENINGS = Map.of(
      Byte.class, Set.of(Short.class, Integer.class, Long.class, Float.class, Double.class),
      Short.class, Set.of(Integer.class, Long.class, Float.class, Double.class),
      Character.class, Set.of(Integer.class, Long.class, Float.class, Double.class),
      Integer.class, Set.of(Long.class, Float.class, Double.class),
      Long.class, Set.of(Float.class, Double.class),
      Float.class, Set.of(Double.class));

  private Conversions() {
    // Utility
  }

  /**
   * Maps primitive classes to their wrapper; other classes are returned unchanged.
   *
   * @param type candidate class
   * @return boxed equivalent
   */
  public static Class<?> box(Class<?> type) {
    Objects.requireNonNull(type, "type");
    Class<?> boxed = BOXES.get(type);
    return boxed != null ? boxed : type;
  }

  /**
   * Indicates whether values of {@code from} convert to {@code to} without a transform.
   *
   * @param from declared source type
   * @param to declared target type
   * @return {@code true} when assignable or primitive-widening compatible
   */
  public static boolean isImplicit(Class<?> from, Class<?> to) {
    Class<?> source = box(from);
    Class<?> target = box(to);
    if (target.isAssignableFrom(source)) {
      return true;
    }
    return WIDENINGS.getOrDefault(source, Set.of()).contains(target);
  }

  /**
   * Converts a runtime value to {@code target} by assignment or primitive widening.
   *
   * @param value value to convert; must not be {@code null}
   * @param target target type
   * @param <T> target type
   * @return the value itself when assignable, otherwise the widened value
   * @throws IllegalArgumentException when the value's runtime type does not convert implicitly
   */
  public static <T> T convert(Object value, Class<T> target) {
    Objects.requireNonNull(value, "value");
    Class<?> boxedTarget = box(target);
    if (boxedTarget.isInstance(value)) {
      @SuppressWarnings("unchecked")
      T same = (T) value;
      return same;
    }
    if (!WIDENINGS.getOrDefault(value.getClass(), Set.of()).contains(boxedTarget)) {
      throw new IllegalArgumentException(
          value.getClass().getName() + " does not convert implicitly to " + target.getName());
    }
    @SuppressWarnings("unchecked")
    T widened = (T) widen(value, boxedTarget);
    return widened;
  }

  private static Object widen(Object value, Class<?> target) {
    Number number = value instanceof Character c ? Integer.valueOf(c.charValue()) : (Number) value;
    if (target == Short.class) {
      return number.shortValue();
    }
    if (target == Integer.class) {
      return number.intValue();
    }
    if (target == Long.class) {
      return number.longValue();
    }
    if (target == Float.class) {
      return number.floatValue();
    }
    return number.doubleValue();
  }
}

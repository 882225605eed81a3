package ca.gc.cra.syncbuf.domain.buffer;

import ca.gc.cra.syncbuf.validation.Strings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Typed declaration of one buffer channel: its name, input type and output type.
 * <p><strong>Why:</strong> Buffers hold heterogeneous channels; the spec instance is the typed key that
 * lets producers and consumers address a channel without casts.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record the declared input/output classes (and element classes for sequence channels).</li>
 *   <li>Derive the {@link ConversionTier} once from the declared classes.</li>
 *   <li>Carry an optional default {@link Transform} used when a write supplies none.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across producers and consumers.</p>
 * <p>Instances compare by identity: two specs with equal names are still different channels.</p>
 *
 * @param <I> producer input type
 * @param <O> stored output type
 * @since 0.1.0
 */
public final class ChannelSpec<I, O> {
  private final String name;
  private final Class<?> inputType;
  private final Class<?> outputType;
  private final Class<?> inputElementType;
  private final Class<?> outputElementType;
  private final Supplier<? extends Collection<?>> collectionFactory;
  private final boolean unmodifiableOutput;
  private final Transform<I, O> defaultTransform;
  private final ConversionTier tier;

  private ChannelSpec(
      String name,
      Class<?> inputType,
      Class<?> outputType,
      Class<?> inputElementType,
      Class<?> outputElementType,
      Supplier<? extends Collection<?>> collectionFactory,
      boolean unmodifiableOutput,
      Transform<I, O> defaultTransform) {
    this.name = requireName(name);
    this.inputType = Conversions.box(Objects.requireNonNull(inputType, "inputType"));
    this.outputType = Conversions.box(Objects.requireNonNull(outputType, "outputType"));
    this.inputElementType = inputElementType == null ? null : Conversions.box(inputElementType);
    this.outputElementType = outputElementType == null ? null : Conversions.box(outputElementType);
    this.collectionFactory = collectionFactory;
    this.unmodifiableOutput = unmodifiableOutput;
    this.defaultTransform = defaultTransform;
    this.tier = deriveTier();
  }

  /**
   * Declares a channel whose input and output types are the same.
   *
   * @param name channel name, unique within a buffer
   * @param type value type
   * @param <T> value type
   * @return channel declaration
   */
  public static <T> ChannelSpec<T, T> identity(String name, Class<T> type) {
    return new ChannelSpec<>(name, type, type, null, null, null, false, null);
  }

  /**
   * Declares a channel converting {@code inputType} values to {@code outputType} values.
   *
   * <p>When the input does not convert implicitly, every write must supply a transform.</p>
   *
   * @param name channel name, unique within a buffer
   * @param inputType producer type
   * @param outputType stored type
   * @param <I> producer type
   * @param <O> stored type
   * @return channel declaration
   */
  public static <I, O> ChannelSpec<I, O> of(String name, Class<I> inputType, Class<O> outputType) {
    return new ChannelSpec<>(name, inputType, outputType, null, null, null, false, null);
  }

  /**
   * Declares a channel with a default transform applied when the input does not convert implicitly.
   *
   * @param name channel name, unique within a buffer
   * @param inputType producer type
   * @param outputType stored type
   * @param transform default conversion; must not be {@code null}
   * @param <I> producer type
   * @param <O> stored type
   * @return channel declaration
   */
  public static <I, O> ChannelSpec<I, O> of(
      String name, Class<I> inputType, Class<O> outputType, Transform<I, O> transform) {
    Objects.requireNonNull(transform, "transform");
    return new ChannelSpec<>(name, inputType, outputType, null, null, null, false, transform);
  }

  /**
   * Declares a list channel converted element by element.
   *
   * <p>With identical element types the producer's list is stored as handed over; otherwise each element
   * is widened into a new unmodifiable list.</p>
   *
   * @param name channel name, unique within a buffer
   * @param inputElementType producer element type
   * @param outputElementType stored element type
   * @param <A> producer element type
   * @param <B> stored element type
   * @return channel declaration
   */
  public static <A, B> ChannelSpec<List<A>, List<B>> elementWise(
      String name, Class<A> inputElementType, Class<B> outputElementType) {
    Objects.requireNonNull(inputElementType, "inputElementType");
    Objects.requireNonNull(outputElementType, "outputElementType");
    return new ChannelSpec<>(
        name, List.class, List.class, inputElementType, outputElementType, ArrayList::new, true, null);
  }

  /**
   * Declares a sequence channel whose output collection is built by {@code factory}.
   *
   * @param name channel name, unique within a buffer
   * @param inputElementType producer element type
   * @param outputElementType stored element type
   * @param factory creates an empty output collection per write
   * @param <A> producer element type
   * @param <B> stored element type
   * @param <C> stored collection type
   * @return channel declaration
   */
  public static <A, B, C extends Collection<B>> ChannelSpec<Iterable<A>, C> elementWise(
      String name, Class<A> inputElementType, Class<B> outputElementType, Supplier<C> factory) {
    Objects.requireNonNull(inputElementType, "inputElementType");
    Objects.requireNonNull(outputElementType, "outputElementType");
    Objects.requireNonNull(factory, "factory");
    return new ChannelSpec<>(
        name, Iterable.class, Collection.class, inputElementType, outputElementType, factory, false, null);
  }

  /**
   * Returns a copy of this declaration carrying {@code transform} as its default.
   *
   * <p>The default only takes effect on {@link ConversionTier#TRANSFORM} channels.</p>
   *
   * @param transform default conversion; must not be {@code null}
   * @return new channel declaration
   */
  public ChannelSpec<I, O> withDefaultTransform(Transform<I, O> transform) {
    Objects.requireNonNull(transform, "transform");
    return new ChannelSpec<>(
        name,
        inputType,
        outputType,
        inputElementType,
        outputElementType,
        collectionFactory,
        unmodifiableOutput,
        transform);
  }

  /**
   * Returns the channel name.
   *
   * @return channel name
   */
  public String name() {
    return name;
  }

  /**
   * Returns the declared (boxed) input type.
   *
   * @return input class
   */
  public Class<?> inputType() {
    return inputType;
  }

  /**
   * Returns the declared (boxed) output type.
   *
   * @return output class
   */
  public Class<?> outputType() {
    return outputType;
  }

  /**
   * Indicates whether the channel carries sequences converted element by element.
   *
   * @return {@code true} for channels created by {@code elementWise}
   */
  public boolean isSequence() {
    return outputElementType != null;
  }

  /**
   * Returns the conversion tier derived from the declared types.
   *
   * @return conversion tier
   */
  public ConversionTier tier() {
    return tier;
  }

  /**
   * Returns the default transform, if any.
   *
   * @return default transform
   */
  public Optional<Transform<I, O>> defaultTransform() {
    return Optional.ofNullable(defaultTransform);
  }

  /**
   * Converts {@code value} using the declared implicit rule for {@link ConversionTier#IDENTITY}.
   *
   * @param value producer value
   * @return stored representation
   * @throws IllegalArgumentException when the runtime value does not convert
   */
  @SuppressWarnings("unchecked")
  public O convertImplicitly(I value) {
    return (O) Conversions.convert(value, outputType);
  }

  /**
   * Converts every element of {@code value} for {@link ConversionTier#ELEMENT_WISE} channels.
   *
   * @param value producer sequence; elements must not be {@code null}
   * @return freshly built output collection
   * @throws IllegalArgumentException when an element does not convert
   * @throws IllegalStateException when the channel is not a sequence channel
   */
  @SuppressWarnings("unchecked")
  public O convertElements(I value) {
    if (!isSequence()) {
      throw new IllegalStateException("channel '" + name + "' is not a sequence channel");
    }
    if (!(value instanceof Iterable<?> source)) {
      throw new IllegalArgumentException(
          "channel '" + name + "' expects an Iterable but got " + value.getClass().getName());
    }
    Collection<Object> target = (Collection<Object>) collectionFactory.get();
    for (Object element : source) {
      if (element == null) {
        throw new IllegalArgumentException("channel '" + name + "' received a null element");
      }
      target.add(Conversions.convert(element, outputElementType));
    }
    if (unmodifiableOutput && target instanceof List<?> list) {
      return (O) Collections.unmodifiableList(list);
    }
    return (O) target;
  }

  private ConversionTier deriveTier() {
    if (isSequence()) {
      if (inputElementType.equals(outputElementType) && outputType.isAssignableFrom(inputType)) {
        return ConversionTier.IDENTITY;
      }
      return Conversions.isImplicit(inputElementType, outputElementType)
          ? ConversionTier.ELEMENT_WISE
          : ConversionTier.TRANSFORM;
    }
    return Conversions.isImplicit(inputType, outputType)
        ? ConversionTier.IDENTITY
        : ConversionTier.TRANSFORM;
  }

  private static String requireName(String name) {
    Objects.requireNonNull(name, "name");
    try {
      return Strings.requireNonBlank("channel name", name);
    } catch (IllegalArgumentException ex) {
      throw new BufferConfigurationException(ex.getMessage(), ex);
    }
  }

  @Override
  public String toString() {
    String in = isSequence() ? inputType.getSimpleName() + "<" + inputElementType.getSimpleName() + ">"
        : inputType.getSimpleName();
    String out = isSequence() ? outputType.getSimpleName() + "<" + outputElementType.getSimpleName() + ">"
        : outputType.getSimpleName();
    return "ChannelSpec[" + name + ": " + in + " -> " + out + ", " + tier + "]";
  }
}

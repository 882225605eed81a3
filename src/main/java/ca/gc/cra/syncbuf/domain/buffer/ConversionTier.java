package ca.gc.cra.syncbuf.domain.buffer;

/**
 * How a channel turns input values into output values, ordered by precedence.
 *
 * @since 0.1.0
 */
public enum ConversionTier {
  /** Input is assignable to, or widens to, the output type; any transform is ignored. */
  IDENTITY,
  /** Both sides are sequences whose element types satisfy {@link #IDENTITY}; any transform is ignored. */
  ELEMENT_WISE,
  /** A transform is mandatory. */
  TRANSFORM
}

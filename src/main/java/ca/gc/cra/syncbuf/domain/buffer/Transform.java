package ca.gc.cra.syncbuf.domain.buffer;

/**
 * Converts a producer's input representation into a channel's stored output representation.
 *
 * <p>Runs on the buffer's worker thread, never on the producer's thread. Implementations may close
 * over call-specific state; a thrown exception or a {@code null} result drops the pending insert.</p>
 *
 * @param <I> producer input type
 * @param <O> channel output type
 * @since 0.1.0
 */
@FunctionalInterface
public interface Transform<I, O> {
  /**
   * Converts one input value.
   *
   * @param input value handed to {@code put}; never {@code null}
   * @return converted value; must not be {@code null}
   * @throws Exception when the conversion fails
   */
  O apply(I input) throws Exception;
}

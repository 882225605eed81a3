package ca.gc.cra.syncbuf.domain.buffer;

/**
 * Raised when a buffer is declared with inconsistent channels or invalid sizing.
 *
 * <p>Fatal to the buffer being constructed; nothing is allocated when it is thrown.</p>
 *
 * @since 0.1.0
 */
public final class BufferConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a diagnostic message.
   *
   * @param message description of the invalid configuration
   */
  public BufferConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates the exception wrapping a lower-level validation failure.
   *
   * @param message description of the invalid configuration
   * @param cause underlying failure
   */
  public BufferConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package ca.gc.cra.syncbuf.domain.buffer;

/**
 * Raised when a value is written to a channel whose input type cannot be converted implicitly and
 * neither the call nor the channel declaration supplies a {@link Transform}.
 *
 * @since 0.1.0
 */
public final class MissingTransformException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String channel;

  /**
   * Creates the exception for a channel.
   *
   * @param channel channel name
   * @param inputType declared input type
   * @param outputType declared output type
   */
  public MissingTransformException(String channel, Class<?> inputType, Class<?> outputType) {
    super("channel '" + channel + "' requires a transform from "
        + inputType.getName() + " to " + outputType.getName());
    this.channel = channel;
  }

  /**
   * Returns the name of the channel that lacked a transform.
   *
   * @return channel name
   */
  public String channel() {
    return channel;
  }
}

package ca.gc.cra.syncbuf.application.sync;

import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import ca.gc.cra.syncbuf.domain.buffer.MissingTransformException;
import ca.gc.cra.syncbuf.domain.buffer.Transform;

/**
 * Picks the conversion applied to one write, following the channel's conversion tier.
 *
 * <p>Resolution runs on the producer's thread for every write so a missing transform fails fast at the
 * call site; the returned conversion itself runs later on the worker.</p>
 */
final class TransformStage {
  private TransformStage() {}

  static <I, O> Transform<I, O> resolve(ChannelSpec<I, O> channel, Transform<I, O> perCall) {
    return switch (channel.tier()) {
      case IDENTITY -> channel::convertImplicitly;
      case ELEMENT_WISE -> channel::convertElements;
      case TRANSFORM -> {
        if (perCall != null) {
          yield perCall;
        }
        yield channel.defaultTransform().orElseThrow(
            () -> new MissingTransformException(channel.name(), channel.inputType(), channel.outputType()));
      }
    };
  }
}

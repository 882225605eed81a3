package ca.gc.cra.syncbuf.application.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import ca.gc.cra.syncbuf.domain.buffer.MissingTransformException;
import ca.gc.cra.syncbuf.domain.buffer.Transform;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransformStageTest {

  @Test
  void implicitChannelsIgnorePerCallTransform() throws Exception {
    ChannelSpec<Integer, Long> widened = ChannelSpec.of("widened", Integer.class, Long.class);

    Transform<Integer, Long> resolved = TransformStage.resolve(widened, v -> -1L);

    assertEquals(7L, resolved.apply(7));
  }

  @Test
  void elementWiseChannelsConvertEachElement() throws Exception {
    ChannelSpec<List<Integer>, List<Double>> samples =
        ChannelSpec.elementWise("samples", Integer.class, Double.class);

    assertEquals(List.of(1.0, 2.0), TransformStage.resolve(samples, null).apply(List.of(1, 2)));
  }

  @Test
  void perCallTransformWinsOverDefault() throws Exception {
    ChannelSpec<Integer, String> labels =
        ChannelSpec.of("labels", Integer.class, String.class, v -> "default-" + v);

    assertEquals("call-3", TransformStage.resolve(labels, v -> "call-" + v).apply(3));
    assertEquals("default-3", TransformStage.resolve(labels, null).apply(3));
  }

  @Test
  void missingTransformFailsImmediately() {
    ChannelSpec<Integer, String> labels = ChannelSpec.of("labels", Integer.class, String.class);

    MissingTransformException ex =
        assertThrows(MissingTransformException.class, () -> TransformStage.resolve(labels, null));
    assertEquals("labels", ex.channel());
  }
}

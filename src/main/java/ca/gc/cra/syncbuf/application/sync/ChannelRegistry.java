package ca.gc.cra.syncbuf.application.sync;

import ca.gc.cra.syncbuf.domain.buffer.BufferConfigurationException;
import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import java.util.Collection;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed, ordered set of channel declarations owned by one buffer; a channel's index is its position.
 */
final class ChannelRegistry {
  private final List<ChannelSpec<?, ?>> channels;
  private final Map<ChannelSpec<?, ?>, Integer> indexBySpec;
  private final int[] allIndices;

  ChannelRegistry(List<? extends ChannelSpec<?, ?>> declared) {
    if (declared == null || declared.isEmpty()) {
      throw new BufferConfigurationException("at least one channel must be declared");
    }
    Map<ChannelSpec<?, ?>, Integer> indices = new IdentityHashMap<>();
    Set<String> names = new HashSet<>();
    for (int i = 0; i < declared.size(); i++) {
      ChannelSpec<?, ?> spec = declared.get(i);
      if (spec == null) {
        throw new BufferConfigurationException("channel " + i + " is null");
      }
      if (indices.put(spec, i) != null) {
        throw new BufferConfigurationException("channel '" + spec.name() + "' declared more than once");
      }
      if (!names.add(spec.name())) {
        throw new BufferConfigurationException("duplicate channel name '" + spec.name() + "'");
      }
    }
    this.channels = List.copyOf(declared);
    this.indexBySpec = indices;
    this.allIndices = new int[channels.size()];
    for (int i = 0; i < allIndices.length; i++) {
      allIndices[i] = i;
    }
  }

  int size() {
    return channels.size();
  }

  List<ChannelSpec<?, ?>> channels() {
    return channels;
  }

  ChannelSpec<?, ?> get(int index) {
    Objects.checkIndex(index, channels.size());
    return channels.get(index);
  }

  int indexOf(ChannelSpec<?, ?> channel) {
    Objects.requireNonNull(channel, "channel");
    Integer index = indexBySpec.get(channel);
    if (index == null) {
      throw new IllegalArgumentException("channel '" + channel.name() + "' does not belong to this buffer");
    }
    return index;
  }

  boolean contains(ChannelSpec<?, ?> channel) {
    return channel != null && indexBySpec.containsKey(channel);
  }

  int[] allIndices() {
    return allIndices.clone();
  }

  int[] indicesOf(Collection<? extends ChannelSpec<?, ?>> selected) {
    Objects.requireNonNull(selected, "channels");
    if (selected.isEmpty()) {
      throw new IllegalArgumentException("at least one channel must be selected");
    }
    Set<Integer> ordered = new LinkedHashSet<>();
    for (ChannelSpec<?, ?> channel : selected) {
      ordered.add(indexOf(channel));
    }
    return ordered.stream().mapToInt(Integer::intValue).toArray();
  }
}

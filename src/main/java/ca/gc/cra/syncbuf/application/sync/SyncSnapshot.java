package ca.gc.cra.syncbuf.application.sync;

import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable result of one buffer read: one optional value per selected channel.
 * <p><strong>Why:</strong> Channels are heterogeneous, so values are retrieved through the channel's own
 * {@link ChannelSpec}, which restores the declared output type.</p>
 * <p>An empty optional means "no acceptable entry" and is ordinary output, not a failure.</p>
 */
public final class SyncSnapshot {
  private final List<ChannelSpec<?, ?>> channels;
  private final int[] selected;
  private final List<Optional<Object>> values;

  SyncSnapshot(List<ChannelSpec<?, ?>> channels, int[] selected, List<Optional<Object>> values) {
    if (selected.length != values.size()) {
      throw new IllegalArgumentException("selected channels and values differ in size");
    }
    this.channels = channels;
    this.selected = selected.clone();
    this.values = List.copyOf(values);
  }

  /**
   * Returns the value read for {@code channel}.
   *
   * @param channel channel declared on the buffer that produced this snapshot
   * @param <O> channel output type
   * @return value, or empty when the channel had no acceptable entry
   * @throws IllegalArgumentException if the channel was not part of the read
   */
  public <O> Optional<O> get(ChannelSpec<?, O> channel) {
    Objects.requireNonNull(channel, "channel");
    int position = positionOf(channel);
    if (position < 0) {
      throw new IllegalArgumentException("channel '" + channel.name() + "' was not selected by this read");
    }
    @SuppressWarnings("unchecked")
    Optional<O> value = (Optional<O>) values.get(position);
    return value;
  }

  /**
   * Returns the value read for the channel at buffer index {@code index}.
   *
   * @param index channel index in declaration order
   * @return value, or empty when the channel had no acceptable entry
   * @throws IllegalArgumentException if the channel was not part of the read
   */
  public Optional<Object> get(int index) {
    Objects.checkIndex(index, channels.size());
    for (int i = 0; i < selected.length; i++) {
      if (selected[i] == index) {
        return values.get(i);
      }
    }
    throw new IllegalArgumentException("channel " + index + " was not selected by this read");
  }

  public boolean isSelected(ChannelSpec<?, ?> channel) {
    return channel != null && positionOf(channel) >= 0;
  }

  /** Number of selected channels that produced a value. */
  public int presentCount() {
    int count = 0;
    for (Optional<Object> value : values) {
      if (value.isPresent()) {
        count++;
      }
    }
    return count;
  }

  /** {@code true} when every selected channel produced a value. */
  public boolean isComplete() {
    return presentCount() == values.size();
  }

  /** {@code true} when no selected channel produced a value. */
  public boolean isEmpty() {
    return presentCount() == 0;
  }

  /** Number of channels included in the read. */
  public int selectedCount() {
    return selected.length;
  }

  private int positionOf(ChannelSpec<?, ?> channel) {
    for (int i = 0; i < selected.length; i++) {
      if (channels.get(selected[i]) == channel) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<>(selected.length);
    for (int i = 0; i < selected.length; i++) {
      String rendered = values.get(i).map(String::valueOf).orElse("<none>");
      parts.add(channels.get(selected[i]).name() + "=" + rendered);
    }
    return "SyncSnapshot" + parts;
  }
}

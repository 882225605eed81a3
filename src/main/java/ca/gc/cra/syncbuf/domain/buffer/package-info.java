/**
 * Domain model for time-synchronized channel buffers.
 * <p><strong>Role:</strong> Channel declarations, bounded per-channel stores, entries, and the implicit
 * conversion rules between a producer's input type and a channel's stored type.</p>
 * <p><strong>Concurrency:</strong> Declarations and entries are immutable. {@link ca.gc.cra.syncbuf.domain.buffer.ChannelStore}
 * is not thread-safe and relies on the owning buffer's lock.</p>
 * <p><strong>Performance:</strong> Stores are small bounded deques; nearest-timestamp lookups scan linearly.</p>
 */
package ca.gc.cra.syncbuf.domain.buffer;

/**
 * Time-synchronized multi-channel buffer: registry, locking core, write scheduling, and read results.
 * <p><strong>Role:</strong> Application layer; {@link ca.gc.cra.syncbuf.application.sync.TimeSyncBuffer} is the
 * public entry point.</p>
 * <p><strong>Concurrency:</strong> One serial worker applies writes; one read/write lock spans every channel so
 * recency comparisons see a consistent cross-channel state.</p>
 * <p><strong>Metrics:</strong> Emits {@code buffer.*} counters through
 * {@link ca.gc.cra.syncbuf.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.syncbuf.application.sync;

/**
 * Ports through which the synchronization core reaches time and metrics.
 * <p><strong>Role:</strong> Application ports implemented by {@code ca.gc.cra.syncbuf.infrastructure} adapters.</p>
 * <p><strong>Concurrency:</strong> Implementations are invoked from producer, worker, and consumer threads.</p>
 */
package ca.gc.cra.syncbuf.application.port;

/**
 * Executor factories for buffer workers and demo threads.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the serial insertion worker.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry only configured prefixes.</p>
 */
package ca.gc.cra.syncbuf.infrastructure.exec;

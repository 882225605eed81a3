/**
 * Command-line entry points: the {@code syncbuf} dispatcher and the producer/consumer demo.
 * <p><strong>Role:</strong> Adapter layer translating CLI arguments into buffer configuration.</p>
 * <p><strong>Observability:</strong> Logs via SLF4J; results are printed through {@link ca.gc.cra.syncbuf.api.CliPrinter}.</p>
 */
package ca.gc.cra.syncbuf.api;

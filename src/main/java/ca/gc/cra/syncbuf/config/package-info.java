/**
 * Configuration records, YAML loading, and composition root wiring for buffers and the demo CLI.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> YAML is parsed with SnakeYAML's {@code SafeConstructor}.</p>
 */
package ca.gc.cra.syncbuf.config;

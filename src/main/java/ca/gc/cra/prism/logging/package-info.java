/**
 * <strong>Purpose:</strong> Logging setup planned from configuration and applied to Logback, plus redaction helpers.
 * <p><strong>Concurrency:</strong> Setup runs once on the bootstrap thread; helpers are stateless.
 * <p><strong>Security:</strong> Credentials are rendered through {@link ca.gc.cra.prism.logging.Logs#redact(String)}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.logging;

/**
 * Server process lifecycle: socket acquisition in three modes, the blocking run and interruption cleanup.
 * <p><strong>Concurrency:</strong> The bootstrap thread drives the lifecycle; a JVM shutdown hook only
 * triggers the {@link ca.gc.cra.prism.application.server.ShutdownSignal}.</p>
 */
package ca.gc.cra.prism.application.server;

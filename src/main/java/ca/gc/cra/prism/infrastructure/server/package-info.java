/**
 * Server adapters: the Netty HTTP server, the shutdown-hook event loop and PATH binary lookup.
 * <p><strong>Concurrency:</strong> Netty runs one acceptor thread and the requested number of workers.</p>
 * <p><strong>Metrics:</strong> Publishes {@code http.requests}, {@code http.responses.*} and
 * {@code http.latencyNanos}.</p>
 */
package ca.gc.cra.prism.infrastructure.server;

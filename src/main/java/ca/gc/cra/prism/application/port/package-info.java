/**
 * Ports implemented by pluggable components and infrastructure adapters.
 * <p><strong>Role:</strong> Plugin contracts (engine, filter, loader, storage, detector, error handler,
 * application) and server seams (HTTP server, descriptors, event loop, binaries, metrics).</p>
 * <p><strong>Concurrency:</strong> Each port documents its own threading contract.</p>
 */
package ca.gc.cra.prism.application.port;

/**
 * Built-in PRISM application served by the HTTP server.
 */
package ca.gc.cra.prism.infrastructure.app;

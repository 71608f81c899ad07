/**
 * Built-in error handlers.
 */
package ca.gc.cra.prism.infrastructure.errors;

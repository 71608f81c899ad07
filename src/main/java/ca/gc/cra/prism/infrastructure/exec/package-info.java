/**
 * Thread naming helpers shared by server adapters.
 */
package ca.gc.cra.prism.infrastructure.exec;

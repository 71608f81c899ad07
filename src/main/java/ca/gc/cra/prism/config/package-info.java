/**
 * Configuration store, server parameters and the composition root for PRISM.
 * <p><strong>Role:</strong> Bootstrap layer: loads settings (YAML file plus optional environment
 * overrides), carries CLI parameters and wires components into the execution context.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Credentials never appear in {@code toString()} output.</p>
 */
package ca.gc.cra.prism.config;

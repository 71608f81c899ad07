/**
 * Built-in image loaders.
 */
package ca.gc.cra.prism.infrastructure.loader;

/**
 * Built-in storages for original and transformed images.
 */
package ca.gc.cra.prism.infrastructure.storage;

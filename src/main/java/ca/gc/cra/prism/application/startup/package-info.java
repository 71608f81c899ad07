/**
 * Startup validation and the execution context handed to the application.
 */
package ca.gc.cra.prism.application.startup;

/**
 * Command-line entry point: argument parsing, telemetry switches, bootstrap wiring and exit codes.
 */
package ca.gc.cra.prism.api;

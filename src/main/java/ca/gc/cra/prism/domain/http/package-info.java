/**
 * HTTP request and response messages exchanged between the server adapter and the application.
 */
package ca.gc.cra.prism.domain.http;

/**
 * Resolution of configured component names through an explicit catalog.
 * <p><strong>Role:</strong> Turns {@code ENGINE}, {@code FILTERS}, {@code LOADER} and friends into live
 * factories and instances; unknown names are fatal at startup.</p>
 */
package ca.gc.cra.prism.application.component;

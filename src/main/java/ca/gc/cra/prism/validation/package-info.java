/**
 * Argument checks shared by the CLI, the configuration layer and the built-in filters.
 * <p>All helpers are stateless and report problems as {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.validation;

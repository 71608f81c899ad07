/**
 * Native descriptor access through jnr-ffi, used to adopt inherited or path-recovered listening sockets.
 * <p><strong>Platform:</strong> POSIX only; the binding loads the platform C library on first use.</p>
 */
package ca.gc.cra.prism.infrastructure.nativeio;

/**
 * Built-in imaging engines: a passthrough engine for still images and a gifsicle-gated one for animated GIFs.
 * <p><strong>Concurrency:</strong> Engines are per-request; factories are shared and thread-safe.</p>
 * <p><strong>Resources:</strong> Each factory owns a scratch directory removed by {@code cleanup()}.</p>
 */
package ca.gc.cra.prism.infrastructure.engine;

package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.application.startup.ExecutionContext;

/**
 * <strong>What:</strong> Factory reference for a per-request component (engine, loader, storage, detector).
 * <p><strong>Why:</strong> The bootstrap resolves a factory once; request handling creates fresh instances
 * bound to the shared {@link ExecutionContext}.</p>
 * <p><strong>Thread-safety:</strong> {@link #create(ExecutionContext)} may be called concurrently from
 * Netty worker threads.</p>
 *
 * @param <T> component type produced per request
 * @since 0.1.0
 */
public interface ComponentFactory<T> {
  /**
   * Creates a component for one request.
   *
   * @param context shared execution context
   * @return new component instance
   */
  T create(ExecutionContext context);

  /**
   * Releases process-wide resources held by this factory. Called once at shutdown.
   */
  default void cleanup() {}
}

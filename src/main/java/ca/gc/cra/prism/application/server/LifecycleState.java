package ca.gc.cra.prism.application.server;

/**
 * States of {@link ServerLifecycle}; transitions only move forward.
 *
 * @since 0.1.0
 */
public enum LifecycleState {
  CREATED,
  BOUND,
  RUNNING,
  STOPPED
}

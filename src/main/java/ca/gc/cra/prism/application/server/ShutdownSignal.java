package ca.gc.cra.prism.application.server;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * <strong>What:</strong> Explicit interruption signal shared by the event loop and the lifecycle manager.
 * <p><strong>Why:</strong> Replaces asynchronous exceptions with ordinary control flow: the event loop
 * returns once the signal is triggered and the lifecycle runs its cleanup on the bootstrap thread.</p>
 * <p><strong>Thread-safety:</strong> Safe to trigger from any thread, including JVM shutdown hooks.</p>
 *
 * @since 0.1.0
 */
public final class ShutdownSignal {
  private final CountDownLatch triggered = new CountDownLatch(1);
  private final CountDownLatch stopped = new CountDownLatch(1);

  /** Requests shutdown. Repeated calls have no further effect. */
  public void trigger() {
    triggered.countDown();
  }

  public boolean isTriggered() {
    return triggered.getCount() == 0;
  }

  /**
   * Blocks until {@link #trigger()} is called. Thread interruption counts as a trigger.
   */
  public void awaitTriggered() {
    try {
      triggered.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      trigger();
    }
  }

  /** Records that cleanup finished. */
  public void markStopped() {
    stopped.countDown();
  }

  public boolean isStopped() {
    return stopped.getCount() == 0;
  }

  /**
   * Waits for cleanup to finish.
   *
   * @param timeout upper bound on the wait
   * @return {@code true} if cleanup finished in time
   */
  public boolean awaitStopped(Duration timeout) {
    try {
      return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return isStopped();
    }
  }
}

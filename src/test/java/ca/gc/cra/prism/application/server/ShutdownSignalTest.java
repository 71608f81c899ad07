package ca.gc.cra.prism.application.server;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ShutdownSignalTest {

  @Test
  void triggerReleasesWaiter() throws InterruptedException {
    ShutdownSignal signal = new ShutdownSignal();
    CountDownLatch released = new CountDownLatch(1);
    Thread waiter = new Thread(() -> {
      signal.awaitTriggered();
      released.countDown();
    });
    waiter.start();

    assertFalse(released.await(50, TimeUnit.MILLISECONDS));
    signal.trigger();

    assertTrue(released.await(5, TimeUnit.SECONDS));
    assertTrue(signal.isTriggered());
  }

  @Test
  void threadInterruptionCountsAsTrigger() throws InterruptedException {
    ShutdownSignal signal = new ShutdownSignal();
    Thread waiter = new Thread(signal::awaitTriggered);
    waiter.start();

    waiter.interrupt();
    waiter.join(5_000);

    assertFalse(waiter.isAlive());
    assertTrue(signal.isTriggered());
  }

  @Test
  void awaitStoppedTimesOutUntilMarked() {
    ShutdownSignal signal = new ShutdownSignal();

    assertFalse(signal.awaitStopped(Duration.ofMillis(20)));
    signal.markStopped();
    assertTrue(signal.awaitStopped(Duration.ofMillis(20)));
    assertTrue(signal.isStopped());
  }
}

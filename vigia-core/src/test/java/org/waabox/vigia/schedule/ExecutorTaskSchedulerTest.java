package org.waabox.vigia.schedule;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ExecutorTaskScheduler}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ExecutorTaskSchedulerTest {

  private ExecutorTaskScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler = new ExecutorTaskScheduler(1);
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
  }

  @Test
  void whenScheduling_givenDelay_shouldRunOnce() throws Exception {
    final CountDownLatch ran = new CountDownLatch(1);

    scheduler.schedule(ran::countDown, Duration.ofMillis(10));

    assertTrue(ran.await(5, TimeUnit.SECONDS));
  }

  @Test
  void whenScheduling_givenFailingPeriodicTask_shouldKeepRunning()
      throws Exception {
    final AtomicInteger runs = new AtomicInteger();
    final CountDownLatch thirdRun = new CountDownLatch(3);

    final ScheduledTask task = scheduler.scheduleAtFixedRate(() -> {
      runs.incrementAndGet();
      thirdRun.countDown();
      throw new IllegalStateException("boom");
    }, Duration.ZERO, Duration.ofMillis(5));

    assertTrue(thirdRun.await(5, TimeUnit.SECONDS));
    task.cancel();
    assertTrue(task.isCancelled());
  }

  @Test
  void whenCancelling_givenPendingTask_shouldNeverRun() throws Exception {
    final AtomicInteger runs = new AtomicInteger();

    final ScheduledTask task = scheduler.schedule(runs::incrementAndGet,
        Duration.ofMillis(200));
    task.cancel();
    Thread.sleep(400);

    assertTrue(task.isCancelled());
    assertFalse(runs.get() > 0);
  }

  @Test
  void whenCreating_givenZeroThreads_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        new ExecutorTaskScheduler(0)
    );
  }
}

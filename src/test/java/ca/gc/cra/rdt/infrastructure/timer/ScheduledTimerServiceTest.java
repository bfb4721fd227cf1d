package ca.gc.cra.rdt.infrastructure.timer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rdt.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScheduledTimerServiceTest {
  private ScheduledExecutorService scheduler;
  private ReentrantLock lock;
  private ScheduledTimerService<String> timers;

  @BeforeEach
  void setUp() {
    scheduler = ExecutorFactories.newTimerScheduler("timer-test", null);
    lock = new ReentrantLock();
    timers = new ScheduledTimerService<>(lock, scheduler);
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void firesOnceUnderTheLock() throws InterruptedException {
    CountDownLatch fired = new CountDownLatch(1);
    AtomicBoolean heldLock = new AtomicBoolean();

    timers.start("a", Duration.ofMillis(10), () -> {
      heldLock.set(lock.isHeldByCurrentThread());
      fired.countDown();
    });

    assertTrue(fired.await(2, TimeUnit.SECONDS));
    assertTrue(heldLock.get());
    assertFalse(timers.isActive("a"));
  }

  @Test
  void cancelledTimerNeverFires() throws InterruptedException {
    AtomicInteger fired = new AtomicInteger();
    timers.start("a", Duration.ofMillis(50), fired::incrementAndGet);

    assertTrue(timers.cancel("a"));
    assertFalse(timers.cancel("a"));
    Thread.sleep(150);

    assertEquals(0, fired.get());
  }

  @Test
  void cancelWhileCallbackWaitsForLockSuppressesIt() throws InterruptedException {
    AtomicInteger fired = new AtomicInteger();
    lock.lock();
    try {
      timers.start("a", Duration.ofMillis(1), fired::incrementAndGet);
      Thread.sleep(100);
      timers.cancel("a");
    } finally {
      lock.unlock();
    }
    Thread.sleep(100);

    assertEquals(0, fired.get());
  }

  @Test
  void startReplacesPendingTimerForSameKey() throws InterruptedException {
    CountDownLatch second = new CountDownLatch(1);
    AtomicInteger first = new AtomicInteger();

    timers.start("a", Duration.ofMillis(30), first::incrementAndGet);
    timers.start("a", Duration.ofMillis(30), second::countDown);

    assertTrue(second.await(2, TimeUnit.SECONDS));
    Thread.sleep(50);
    assertEquals(0, first.get());
  }

  @Test
  void restartReusesCallbackAndUnknownKeyIsRejected() throws InterruptedException {
    CountDownLatch fired = new CountDownLatch(2);
    timers.start("a", Duration.ofMillis(5), fired::countDown);
    Thread.sleep(100);

    assertTrue(timers.restart("a", Duration.ofMillis(5)));
    assertTrue(fired.await(2, TimeUnit.SECONDS));
    assertFalse(timers.restart("missing", Duration.ofMillis(5)));
  }

  @Test
  void cancelAllDisarmsEverything() throws InterruptedException {
    AtomicInteger fired = new AtomicInteger();
    timers.start("a", Duration.ofMillis(40), fired::incrementAndGet);
    timers.start("b", Duration.ofMillis(40), fired::incrementAndGet);

    timers.cancelAll();
    Thread.sleep(120);

    assertEquals(0, fired.get());
    assertFalse(timers.isActive("a"));
  }
}

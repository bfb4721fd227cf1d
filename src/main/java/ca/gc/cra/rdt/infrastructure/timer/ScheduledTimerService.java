package ca.gc.cra.rdt.infrastructure.timer;

import ca.gc.cra.rdt.application.port.TimerService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TimerService} backed by a shared {@link ScheduledExecutorService}.
 * <p><strong>Why:</strong> Avoids a thread per timer while keeping cancellation race-free.</p>
 * <p><strong>Role:</strong> Infrastructure adapter owned by one endpoint and bound to that endpoint's lock.</p>
 * <p><strong>Thread-safety:</strong> All state is guarded by the endpoint lock. Scheduled tasks acquire the lock
 * and check a generation stamp before running, so a task that lost the race with {@link #cancel} or
 * {@link #restart} does nothing.</p>
 * <p><strong>Performance:</strong> O(log n) scheduling in the executor's delay queue.</p>
 *
 * @param <K> timer key type
 * @since 0.1.0
 */
public final class ScheduledTimerService<K> implements TimerService<K> {
  private static final Logger log = LoggerFactory.getLogger(ScheduledTimerService.class);

  private final ReentrantLock lock;
  private final ScheduledExecutorService scheduler;
  private final Map<K, Entry> entries = new HashMap<>();
  private long generation;

  /**
   * Creates a timer service.
   *
   * @param lock endpoint lock under which callbacks run
   * @param scheduler shared scheduler; not shut down by this service
   */
  public ScheduledTimerService(ReentrantLock lock, ScheduledExecutorService scheduler) {
    this.lock = Objects.requireNonNull(lock, "lock");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public void start(K key, Duration delay, Runnable onFire) {
    Objects.requireNonNull(onFire, "onFire");
    lock.lock();
    try {
      Entry previous = entries.get(key);
      if (previous != null) {
        previous.disarm();
      }
      Entry entry = new Entry(onFire);
      entries.put(key, entry);
      schedule(key, entry, delay);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean cancel(K key) {
    lock.lock();
    try {
      Entry entry = entries.remove(key);
      if (entry == null) {
        return false;
      }
      boolean wasLive = entry.live;
      entry.disarm();
      return wasLive;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean restart(K key, Duration delay) {
    lock.lock();
    try {
      Entry entry = entries.get(key);
      if (entry == null) {
        return false;
      }
      entry.disarm();
      schedule(key, entry, delay);
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isActive(K key) {
    lock.lock();
    try {
      Entry entry = entries.get(key);
      return entry != null && entry.live;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void cancelAll() {
    lock.lock();
    try {
      List<Entry> all = new ArrayList<>(entries.values());
      entries.clear();
      for (Entry entry : all) {
        entry.disarm();
      }
    } finally {
      lock.unlock();
    }
  }

  private void schedule(K key, Entry entry, Duration delay) {
    long stamp = ++generation;
    entry.generation = stamp;
    entry.live = true;
    try {
      entry.future = scheduler.schedule(() -> fire(key, stamp), Math.max(0L, delay.toNanos()), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException ex) {
      entry.live = false;
      log.debug("Timer {} not scheduled; scheduler is shut down", key);
    }
  }

  private void fire(K key, long stamp) {
    lock.lock();
    try {
      Entry entry = entries.get(key);
      if (entry == null || !entry.live || entry.generation != stamp) {
        return;
      }
      entry.live = false;
      entry.future = null;
      try {
        entry.callback.run();
      } catch (RuntimeException ex) {
        log.error("Timer callback for {} failed", key, ex);
      }
    } finally {
      lock.unlock();
    }
  }

  private static final class Entry {
    private final Runnable callback;
    private ScheduledFuture<?> future;
    private long generation;
    private boolean live;

    private Entry(Runnable callback) {
      this.callback = callback;
    }

    private void disarm() {
      live = false;
      if (future != null) {
        future.cancel(false);
        future = null;
      }
    }
  }
}

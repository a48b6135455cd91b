package ledgerstore.health;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import ledgerstore.Deadline;

/**
 * Runs a {@link DependencyChecker} on a fixed delay and keeps the latest report.
 *
 * <p>Pointed at a {@link ConnectionHealthChecker}, this is what reconnects a store that was
 * down at startup or lost its session while nobody asked for health.
 *
 * <p>{@link #start()} and {@link #close()} are idempotent; a closed monitor cannot be restarted.
 */
public final class HealthMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());

  private final DependencyChecker checker;
  private final Duration interval;
  private final Duration checkTimeout;

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> checkTask;
  private volatile boolean closed;
  private volatile DependencyHealth latest;

  public HealthMonitor(DependencyChecker checker, Duration interval, Duration checkTimeout) {
    this.checker = Objects.requireNonNull(checker, "checker");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.checkTimeout = Objects.requireNonNull(checkTimeout, "checkTimeout");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (checkTimeout.isZero() || checkTimeout.isNegative()) {
      throw new IllegalArgumentException("checkTimeout must be positive");
    }
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("HealthMonitor has been closed");
    }
    if (scheduler != null) {
      return;
    }
    AtomicInteger threadCounter = new AtomicInteger(1);
    scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "ledgerstore-health-" + threadCounter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    });
    long delayMs = interval.toMillis();
    checkTask = scheduler.scheduleWithFixedDelay(this::checkOnce, delayMs, delayMs, TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Health monitor for {0} started (every {1} ms)", new Object[]{checker.name(), delayMs});
  }

  /**
   * Runs one check. Called by the schedule; tests may call it directly.
   */
  public DependencyHealth checkOnce() {
    if (closed) {
      return latest;
    }
    try {
      DependencyHealth health = checker.check(Deadline.after(checkTimeout));
      DependencyHealth previous = latest;
      latest = health;
      if (previous != null && previous.status() != health.status()) {
        logger.log(Level.INFO, "{0} is now {1}: {2}",
            new Object[]{checker.name(), health.status(), health.message()});
      }
      return health;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Health check for " + checker.name() + " failed", e);
      return latest;
    }
  }

  /** Latest report, or {@code null} before the first check. */
  public DependencyHealth latest() {
    return latest;
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (checkTask != null) {
      checkTask.cancel(false);
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}

package ledgerstore;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import ledgerstore.error.StoreException;

/**
 * A point in time after which a blocking operation must give up.
 *
 * <p>Deadlines are measured on {@link System#nanoTime()} and are immutable. Every blocking
 * call in this library takes one; {@link #none()} means the caller imposes no limit and only
 * the operation's own timeouts apply. Thread interruption is treated the same way as expiry.
 */
public final class Deadline {
  private static final Deadline NONE = new Deadline(Long.MAX_VALUE, false);

  private final long deadlineNanos;
  private final boolean bounded;

  private Deadline(long deadlineNanos, boolean bounded) {
    this.deadlineNanos = deadlineNanos;
    this.bounded = bounded;
  }

  public static Deadline none() {
    return NONE;
  }

  public static Deadline after(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0, got: " + timeout);
    }
    return new Deadline(System.nanoTime() + saturatedNanos(timeout), true);
  }

  /**
   * Returns whichever of this deadline and {@code now + timeout} comes first.
   */
  public Deadline atMost(Duration timeout) {
    Deadline candidate = after(timeout);
    if (!bounded) {
      return candidate;
    }
    return candidate.deadlineNanos - deadlineNanos < 0 ? candidate : this;
  }

  public boolean isBounded() {
    return bounded;
  }

  public boolean isExpired() {
    return bounded && deadlineNanos - System.nanoTime() <= 0;
  }

  /**
   * Remaining time, never negative. Unbounded deadlines report {@link Long#MAX_VALUE} nanos.
   */
  public Duration remaining() {
    if (!bounded) {
      return Duration.ofNanos(Long.MAX_VALUE);
    }
    return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
  }

  public long remainingMillis() {
    if (!bounded) {
      return Long.MAX_VALUE;
    }
    return TimeUnit.NANOSECONDS.toMillis(Math.max(0L, deadlineNanos - System.nanoTime()));
  }

  /**
   * Query timeout for {@link java.sql.Statement#setQueryTimeout(int)}: zero when unbounded,
   * otherwise the remaining seconds rounded up (at least one).
   */
  public int queryTimeoutSeconds() {
    if (!bounded) {
      return 0;
    }
    long nanos = Math.max(0L, deadlineNanos - System.nanoTime());
    long seconds = (nanos + TimeUnit.SECONDS.toNanos(1) - 1) / TimeUnit.SECONDS.toNanos(1);
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds));
  }

  /**
   * Fails fast with {@code UNAVAILABLE} when the deadline has passed or the thread was interrupted.
   *
   * @param operation name used in the exception message
   */
  public void check(String operation) {
    if (Thread.currentThread().isInterrupted()) {
      throw StoreException.unavailable(operation + ": interrupted");
    }
    if (isExpired()) {
      throw StoreException.unavailable(operation + ": deadline exceeded");
    }
  }

  /**
   * Sleeps for {@code millis}, failing with {@code UNAVAILABLE} instead if the sleep would
   * outlast the deadline.
   */
  public void sleep(long millis, String operation) throws InterruptedException {
    if (bounded && millis > remainingMillis()) {
      throw StoreException.unavailable(operation + ": deadline exceeded while backing off");
    }
    if (millis > 0) {
      Thread.sleep(millis);
    }
  }

  private static long saturatedNanos(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE / 2;
    }
  }

  @Override
  public String toString() {
    return bounded ? "Deadline[remaining=" + remaining() + "]" : "Deadline[none]";
  }
}

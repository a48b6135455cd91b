package ledgerstore.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * 2^(failedAttempts-1)}, capped at {@code maxDelay}.
 *
 * <p>Jitter is off by default so that connect schedules are predictable (1s, 2s, 4s, 8s with
 * the default base delay). {@link #withJitter()} spreads each delay over [0.5, 1.5) for
 * fleets that reconnect together.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, false);
  }

  private ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public ExponentialBackoffRetryPolicy withJitter() {
    return new ExponentialBackoffRetryPolicy(baseDelayMs, maxDelayMs, true);
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    if (failedAttempts <= 0) {
      return 0L;
    }
    long delay;
    if (failedAttempts >= 63 || (1L << (failedAttempts - 1)) > maxDelayMs / baseDelayMs) {
      delay = maxDelayMs;
    } else {
      delay = Math.min(maxDelayMs, baseDelayMs * (1L << (failedAttempts - 1)));
    }
    if (!jitter) {
      return delay;
    }
    long withJitter = (long) (delay * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }
}

package ledgerstore.jdbc.repository;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out strictly increasing microsecond timestamps.
 *
 * <p>Each write stamps {@code updated_at} with a value no other write in this process
 * receives, which lets the read-after-write check tell its own write apart from a competing
 * one that produced the same version number.
 */
public final class MonotonicClock {
  public static final MonotonicClock SYSTEM = new MonotonicClock(Clock.systemUTC());

  private final Clock clock;
  private final AtomicReference<Instant> last = new AtomicReference<>(Instant.EPOCH);

  public MonotonicClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Instant next() {
    while (true) {
      Instant previous = last.get();
      Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
      Instant candidate = now.isAfter(previous) ? now : previous.plus(1, ChronoUnit.MICROS);
      if (last.compareAndSet(previous, candidate)) {
        return candidate;
      }
    }
  }
}

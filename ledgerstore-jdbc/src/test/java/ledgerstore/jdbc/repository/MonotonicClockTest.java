package ledgerstore.jdbc.repository;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

class MonotonicClockTest {

  @Test
  void frozenClockStillAdvancesByOneMicrosecond() {
    Instant now = Instant.parse("2026-03-01T12:00:00.123456789Z");
    MonotonicClock clock = new MonotonicClock(Clock.fixed(now, ZoneOffset.UTC));

    Instant first = clock.next();
    Instant second = clock.next();

    assertEquals(now.truncatedTo(ChronoUnit.MICROS), first);
    assertEquals(first.plus(1, ChronoUnit.MICROS), second);
  }

  @Test
  void systemClockIsStrictlyIncreasing() {
    Instant previous = MonotonicClock.SYSTEM.next();
    for (int i = 0; i < 1000; i++) {
      Instant next = MonotonicClock.SYSTEM.next();
      assertTrue(next.isAfter(previous));
      assertEquals(0, next.getNano() % 1000);
      previous = next;
    }
  }
}

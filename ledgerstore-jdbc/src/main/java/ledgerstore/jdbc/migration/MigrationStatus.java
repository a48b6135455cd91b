package ledgerstore.jdbc.migration;

import java.time.Instant;
import java.util.List;

/**
 * Applied and pending migrations at one point in time.
 *
 * @param applied successful ledger entries, ascending by version
 * @param pending on-disk scripts not yet applied, ascending by version
 * @param total   number of scripts on disk
 * @param lastRun execution time of the latest applied script, or {@code null}
 * @param drifted ids of applied scripts whose on-disk checksum no longer matches the ledger
 */
public record MigrationStatus(
    List<MigrationRecord> applied,
    List<Migration> pending,
    int total,
    Instant lastRun,
    List<String> drifted
) {
  public MigrationStatus {
    applied = List.copyOf(applied);
    pending = List.copyOf(pending);
    drifted = List.copyOf(drifted);
  }

  public int appliedCount() {
    return applied.size();
  }

  public int pendingCount() {
    return pending.size();
  }

  public boolean isUpToDate() {
    return pending.isEmpty();
  }

  /**
   * One-line summary, for example {@code "All 3 migrations applied"} or
   * {@code "2 applied, 1 pending"}.
   */
  public String summary() {
    if (pending.isEmpty()) {
      return "All " + applied.size() + " migrations applied";
    }
    return applied.size() + " applied, " + pending.size() + " pending";
  }
}

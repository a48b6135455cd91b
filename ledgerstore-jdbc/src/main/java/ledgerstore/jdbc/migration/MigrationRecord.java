package ledgerstore.jdbc.migration;

import java.time.Instant;

/**
 * One row of the migration ledger.
 *
 * @param version         sequence number of the script
 * @param name            script description
 * @param checksum        checksum of the script when it ran
 * @param executedAt      when execution finished
 * @param executionTimeMs execution duration
 * @param appliedBy       operator or process that ran the script
 * @param success         whether the script completed
 * @param errorMessage    failure text for unsuccessful runs, otherwise {@code null}
 */
public record MigrationRecord(
    int version,
    String name,
    String checksum,
    Instant executedAt,
    long executionTimeMs,
    String appliedBy,
    boolean success,
    String errorMessage
) {
  public String id() {
    return String.format("%03d_%s", version, name);
  }
}

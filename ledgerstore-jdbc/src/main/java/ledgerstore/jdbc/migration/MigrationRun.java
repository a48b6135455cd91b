package ledgerstore.jdbc.migration;

import java.util.List;

/**
 * Outcome of {@link MigrationRunner#run}.
 *
 * @param dryRun  whether the run only planned
 * @param planned pending scripts in execution order
 * @param applied ledger entries written by this run; empty for dry runs
 */
public record MigrationRun(boolean dryRun, List<Migration> planned, List<MigrationRecord> applied) {
  public MigrationRun {
    planned = List.copyOf(planned);
    applied = List.copyOf(applied);
  }
}

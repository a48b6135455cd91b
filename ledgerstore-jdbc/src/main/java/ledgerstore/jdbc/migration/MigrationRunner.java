package ledgerstore.jdbc.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import ledgerstore.Deadline;
import ledgerstore.SessionLease;
import ledgerstore.jdbc.JdbcTemplate;
import ledgerstore.jdbc.TableNames;
import ledgerstore.jdbc.spi.Dialect;
import ledgerstore.spi.MetricsExporter;
import ledgerstore.spi.SessionProvider;

/**
 * Applies on-disk migration scripts to an append-only store and keeps the
 * {@code <service>_schema_migrations} ledger.
 *
 * <p>Pending scripts are applied one at a time in ascending version order, each inside a
 * transaction together with its ledger entry. The first failure is recorded in the ledger
 * and aborts the run; scripts applied before it stay applied. A changed checksum for an
 * applied script is logged as drift and never blocks a run, since applied changes cannot be
 * rolled back.
 *
 * <p>Before running, scripts are checked for sequence gaps, duplicates, out-of-order
 * versions and (unless allowed) destructive statements. During the run, every
 * {@code CREATE INDEX} is preceded by a row count of its table, and the script fails if the
 * table already holds data.
 */
public final class MigrationRunner {
  private static final Logger logger = Logger.getLogger(MigrationRunner.class.getName());

  private final SessionProvider sessions;
  private final MigrationConfig config;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final MigrationLedger ledger;
  private final boolean transactionalDdl;
  private final Object runLock = new Object();

  public MigrationRunner(SessionProvider sessions, Dialect dialect, MigrationConfig config) {
    this(sessions, dialect, config, MetricsExporter.NOOP, Clock.systemUTC());
  }

  public MigrationRunner(SessionProvider sessions, Dialect dialect, MigrationConfig config,
      MetricsExporter metrics, Clock clock) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    Objects.requireNonNull(dialect, "dialect");
    this.transactionalDdl = dialect.transactionalDdl();
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ledger = new MigrationLedger(dialect, config.tableName(), config.serviceName());
  }

  public MigrationConfig config() {
    return config;
  }

  /**
   * Diffs the scripts on disk against the ledger, creating the ledger table if needed.
   */
  public MigrationStatus status(Deadline deadline) {
    List<Migration> onDisk = MigrationScripts.load(config.directory());
    return withSession(deadline, "read migration status", conn -> computeStatus(conn, deadline, onDisk));
  }

  /**
   * Applies pending scripts, or only plans them when the config says dry run.
   */
  public MigrationRun run(Deadline deadline) {
    return run(deadline, config.dryRun());
  }

  /**
   * Applies pending scripts in ascending order.
   *
   * @param dryRun when {@code true}, reports the plan without executing anything
   * @throws MigrationException when the scripts fail the pre-run checks or a script fails
   */
  public MigrationRun run(Deadline deadline, boolean dryRun) {
    synchronized (runLock) {
      List<Migration> onDisk = MigrationScripts.load(config.directory());
      List<String> sequenceProblems = MigrationScripts.sequenceProblems(onDisk);
      if (!sequenceProblems.isEmpty()) {
        throw new MigrationException("refusing to run migrations", sequenceProblems);
      }
      return withSession(deadline, "run migrations", conn -> {
        MigrationStatus status = computeStatus(conn, deadline, onDisk);
        checkPending(status);
        if (status.pending().isEmpty()) {
          logger.info("No pending migrations (" + status.summary() + ")");
          return new MigrationRun(dryRun, List.of(), List.of());
        }
        if (dryRun) {
          for (Migration migration : status.pending()) {
            logger.info("[DRY RUN] Would apply migration " + migration.id());
          }
          return new MigrationRun(true, status.pending(), List.of());
        }
        List<MigrationRecord> applied = new ArrayList<>();
        for (Migration migration : status.pending()) {
          applied.add(apply(conn, deadline, migration));
        }
        logger.info("Applied " + applied.size() + " migration(s) to " + ledger.table());
        return new MigrationRun(false, status.pending(), applied);
      });
    }
  }

  /**
   * Checks every script on disk without touching the store: file naming, sequence
   * contiguity, basic syntax and, unless allowed, destructive statements.
   *
   * @throws MigrationException listing every problem found
   */
  public void validate() {
    Path directory = config.directory();
    List<String> problems = new ArrayList<>();
    for (String fileName : MigrationScripts.invalidFileNames(directory)) {
      problems.add("invalid migration file name (expected NNN_description.sql): " + fileName);
    }
    List<Migration> migrations = MigrationScripts.load(directory);
    problems.addAll(MigrationScripts.sequenceProblems(migrations));

    for (Migration migration : migrations) {
      String file = migration.path().getFileName().toString();
      List<String> statements;
      try {
        statements = MigrationScripts.splitStatements(migration.content());
      } catch (MigrationException e) {
        problems.add(file + ": " + e.getMessage());
        continue;
      }
      problems.addAll(MigrationScripts.syntaxProblems(migration));
      if (!config.allowDestructive()) {
        for (String statement : MigrationScripts.destructiveStatements(statements)) {
          problems.add(file + ": destructive statement not allowed on an append-only store: "
              + abbreviate(statement));
        }
      }
      for (String statement : MigrationScripts.nonIdempotentCreates(statements)) {
        logger.warning(file + ": CREATE TABLE without IF NOT EXISTS is not idempotent: " + abbreviate(statement));
      }
    }

    if (!problems.isEmpty()) {
      throw new MigrationException("migration validation failed", problems);
    }
    logger.info("Validated " + migrations.size() + " migration(s) in " + directory);
  }

  /**
   * Writes a skeleton script with the next free version number.
   *
   * @param name free-form description; reduced to {@code [a-z0-9_]}
   * @return path of the new file
   * @throws IllegalArgumentException if nothing usable remains of {@code name}
   */
  public Path createMigration(String name) {
    Objects.requireNonNull(name, "name");
    String sanitized = MigrationScripts.sanitizeName(name);
    if (sanitized.isEmpty()) {
      throw new IllegalArgumentException("Invalid migration name: '" + name + "'");
    }
    Path directory = config.directory();
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new MigrationException("failed to create migrations directory " + directory, e);
    }
    String fileId = String.format("%03d_%s", MigrationScripts.nextVersion(directory), sanitized);
    Path file = directory.resolve(fileId + ".sql");
    String content = MigrationScripts.template(fileId, config.serviceName(), config.appliedBy(), clock.instant());
    try {
      Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    } catch (FileAlreadyExistsException e) {
      throw new MigrationException("migration file already exists: " + file, e);
    } catch (IOException e) {
      throw new MigrationException("failed to write migration " + file, e);
    }
    logger.info("Created migration " + file);
    return file;
  }

  private MigrationStatus computeStatus(Connection conn, Deadline deadline, List<Migration> onDisk)
      throws SQLException {
    ledger.ensureTable(conn, deadline);
    Map<Integer, MigrationRecord> appliedByVersion = new LinkedHashMap<>();
    for (MigrationRecord record : ledger.applied(conn, deadline)) {
      appliedByVersion.putIfAbsent(record.version(), record);
    }

    List<Migration> pending = new ArrayList<>();
    List<String> drifted = new ArrayList<>();
    Set<Integer> onDiskVersions = new HashSet<>();
    for (Migration migration : onDisk) {
      onDiskVersions.add(migration.version());
      MigrationRecord record = appliedByVersion.get(migration.version());
      if (record == null) {
        pending.add(migration);
      } else if (!record.checksum().equals(migration.checksum())) {
        drifted.add(migration.id());
        logger.warning("Checksum mismatch for applied migration " + migration.id()
            + " (recorded " + record.checksum() + ", on disk " + migration.checksum()
            + "); applied migrations must not be modified");
      }
    }
    for (MigrationRecord record : appliedByVersion.values()) {
      if (!onDiskVersions.contains(record.version())) {
        logger.warning("Applied migration " + record.id() + " is missing on disk");
      }
    }

    List<MigrationRecord> applied = new ArrayList<>(appliedByVersion.values());
    Instant lastRun = applied.stream()
        .map(MigrationRecord::executedAt)
        .filter(Objects::nonNull)
        .max(Comparator.naturalOrder())
        .orElse(null);
    return new MigrationStatus(applied, pending, onDisk.size(), lastRun, drifted);
  }

  private void checkPending(MigrationStatus status) {
    int highestApplied = status.applied().stream().mapToInt(MigrationRecord::version).max().orElse(0);
    List<String> problems = new ArrayList<>();
    for (Migration migration : status.pending()) {
      if (migration.version() < highestApplied) {
        problems.add(migration.id() + " is older than already applied version " + highestApplied);
      }
      List<String> statements = MigrationScripts.splitStatements(migration.content());
      if (statements.isEmpty()) {
        problems.add(migration.id() + " contains no statements");
      }
      if (!config.allowDestructive()) {
        for (String statement : MigrationScripts.destructiveStatements(statements)) {
          problems.add(migration.id() + ": destructive statement not allowed on an append-only store: "
              + abbreviate(statement));
        }
      }
    }
    if (!problems.isEmpty()) {
      throw new MigrationException("refusing to run migrations", problems);
    }
  }

  private MigrationRecord apply(Connection conn, Deadline deadline, Migration migration) throws SQLException {
    Deadline scriptDeadline = deadline.atMost(config.timeout());
    List<String> statements = MigrationScripts.splitStatements(migration.content());
    logger.info("Applying migration " + migration.id() + " (" + statements.size() + " statement(s))");

    long startNanos = System.nanoTime();
    boolean autoCommit = conn.getAutoCommit();
    MigrationRecord record = null;
    Exception failure = null;
    conn.setAutoCommit(false);
    try {
      for (String statement : statements) {
        if (config.verifyIndexTargetsEmpty()) {
          verifyIndexTargetEmpty(conn, scriptDeadline, migration, statement);
        }
        JdbcTemplate.execute(conn, scriptDeadline, statement);
      }
      record = ledger.append(conn, scriptDeadline, migration, clock.instant(), elapsedMs(startNanos),
          config.appliedBy(), null);
      conn.commit();
    } catch (SQLException | RuntimeException e) {
      failure = e;
      try {
        conn.rollback();
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
    } finally {
      conn.setAutoCommit(autoCommit);
    }

    if (failure == null) {
      metrics.incrementMigrationApplied();
      logger.info("Applied migration " + migration.id() + " in " + record.executionTimeMs() + " ms");
      return record;
    }

    metrics.incrementMigrationFailed();
    String message = failure.getMessage() == null ? failure.getClass().getName() : failure.getMessage();
    try {
      ledger.append(conn, Deadline.after(config.timeout()), migration, clock.instant(), elapsedMs(startNanos),
          config.appliedBy(), message);
    } catch (SQLException recordFailure) {
      failure.addSuppressed(recordFailure);
      logger.log(Level.WARNING, "Failed to record failure of migration " + migration.id(), recordFailure);
    }
    logger.log(Level.SEVERE, "Migration " + migration.id() + " failed", failure);
    if (!transactionalDdl) {
      logger.warning("DDL is not transactional on this store; statements of " + migration.id()
          + " that ran before the failure may remain applied");
    }
    throw new MigrationException("migration " + migration.id() + " failed: " + message, failure);
  }

  private static void verifyIndexTargetEmpty(Connection conn, Deadline deadline, Migration migration,
      String statement) throws SQLException {
    Optional<String> target = MigrationScripts.indexTarget(statement);
    if (target.isEmpty()) {
      return;
    }
    String table = TableNames.validateQualified(target.get());
    long rows = JdbcTemplate.queryForLong(conn, deadline, "SELECT COUNT(*) FROM " + table);
    if (rows > 0) {
      throw new MigrationException(migration.id() + ": refusing to create an index on non-empty table "
          + table + " (" + rows + " rows); indexes on an append-only store can only be added to empty tables");
    }
  }

  @FunctionalInterface
  private interface SessionWork<R> {
    R run(Connection conn) throws SQLException;
  }

  private <R> R withSession(Deadline deadline, String operation, SessionWork<R> work) {
    Objects.requireNonNull(deadline, "deadline");
    try (SessionLease lease = sessions.acquire(deadline)) {
      try {
        return work.run(lease.connection());
      } catch (SQLException e) {
        lease.reportFailure(e);
        throw new MigrationException(operation + " failed: " + e.getMessage(), e);
      }
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static String abbreviate(String statement) {
    String oneLine = statement.replaceAll("\\s+", " ");
    return oneLine.length() <= 80 ? oneLine : oneLine.substring(0, 77) + "...";
  }
}

package ledgerstore.cli;

import ledgerstore.ConnectionManager;
import ledgerstore.Deadline;
import ledgerstore.error.StoreException;
import ledgerstore.jdbc.JdbcSessionFactory;
import ledgerstore.jdbc.dialect.Dialects;
import ledgerstore.jdbc.migration.Migration;
import ledgerstore.jdbc.migration.MigrationConfig;
import ledgerstore.jdbc.migration.MigrationException;
import ledgerstore.jdbc.migration.MigrationRecord;
import ledgerstore.jdbc.migration.MigrationRun;
import ledgerstore.jdbc.migration.MigrationRunner;
import ledgerstore.jdbc.migration.MigrationStatus;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point of the {@code migrate} command line.
 *
 * <pre>
 * migrate up [--dry-run] [--migrations dir]
 * migrate status
 * migrate validate
 * migrate create &lt;name&gt;
 * migrate version
 * </pre>
 *
 * <p>The store is addressed through {@code LEDGERSTORE_JDBC_URL}, {@code LEDGERSTORE_USERNAME},
 * {@code LEDGERSTORE_PASSWORD} and {@code LEDGERSTORE_DATABASE}. The SQL dialect is detected
 * from the URL unless {@code LEDGERSTORE_DIALECT} names one. Only {@code up} and
 * {@code status} connect.
 */
public final class MigrateCommand {
  private static final Logger logger = Logger.getLogger(MigrateCommand.class.getName());

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  static final String ENV_URL = "LEDGERSTORE_JDBC_URL";
  static final String ENV_USERNAME = "LEDGERSTORE_USERNAME";
  static final String ENV_PASSWORD = "LEDGERSTORE_PASSWORD";
  static final String ENV_DATABASE = "LEDGERSTORE_DATABASE";
  static final String ENV_DIALECT = "LEDGERSTORE_DIALECT";

  static final String DEFAULT_URL = "jdbc:postgresql://localhost:5432/defaultdb";
  static final String DEFAULT_USERNAME = "ledger";
  static final String DEFAULT_PASSWORD = "ledger";

  private static final int CHECKSUM_PREFIX = 12;

  private final Map<String, String> env;
  private final PrintStream out;
  private final PrintStream err;
  private final BuildInfo buildInfo;

  public MigrateCommand(Map<String, String> env, PrintStream out, PrintStream err, BuildInfo buildInfo) {
    this.env = Objects.requireNonNull(env, "env");
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
    this.buildInfo = Objects.requireNonNull(buildInfo, "buildInfo");
  }

  public static void main(String[] args) {
    int exit = new MigrateCommand(System.getenv(), System.out, System.err, BuildInfo.load()).run(args);
    System.exit(exit);
  }

  /**
   * Runs one command.
   *
   * @return the process exit code: 0 on success, 1 on failure, 2 on a usage error
   */
  public int run(String... args) {
    CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (IllegalArgumentException e) {
      return usageError(e.getMessage());
    }
    if (options.verbose()) {
      enableVerboseLogging();
    }

    try {
      switch (options.command()) {
        case "up":
          return up(options);
        case "status":
          return status(options);
        case "validate":
          return validate(options);
        case "create":
          return create(options);
        case "version":
          out.println("migrate " + buildInfo);
          return EXIT_OK;
        case "help":
          printUsage(out);
          return EXIT_OK;
        default:
          return usageError("unknown command: " + options.command());
      }
    } catch (MigrationException e) {
      err.println("error: " + e.getMessage());
      for (String problem : e.problems()) {
        err.println("  - " + problem);
      }
      logger.log(Level.FINE, "Migration command failed", e);
      return EXIT_FAILURE;
    } catch (StoreException e) {
      err.println("error: " + e.getMessage() + " (" + e.kind() + ")");
      logger.log(Level.FINE, "Store unavailable", e);
      return EXIT_FAILURE;
    } catch (IllegalArgumentException e) {
      err.println("error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private int up(CliOptions options) {
    JdbcSessionFactory sessionFactory = sessionFactory();
    try (ConnectionManager manager = connectionManager(sessionFactory)) {
      manager.connect(Deadline.after(options.timeout()));
      MigrationRun run = runner(options, manager, sessionFactory).run(Deadline.none(), options.dryRun());
      if (run.planned().isEmpty()) {
        out.println("No pending migrations. Schema is up to date.");
      } else if (run.dryRun()) {
        out.println("Dry run: " + run.planned().size() + " migration(s) would be applied");
        for (Migration migration : run.planned()) {
          out.println("  " + migration.id());
        }
      } else {
        for (MigrationRecord record : run.applied()) {
          out.println("Applied " + record.id() + " (" + record.executionTimeMs() + " ms)");
        }
        out.println("Applied " + run.applied().size() + " migration(s)");
      }
      return EXIT_OK;
    }
  }

  private int status(CliOptions options) {
    JdbcSessionFactory sessionFactory = sessionFactory();
    try (ConnectionManager manager = connectionManager(sessionFactory)) {
      manager.connect(Deadline.after(options.timeout()));
      MigrationStatus status = runner(options, manager, sessionFactory).status(Deadline.after(options.timeout()));
      printStatus(status);
      return EXIT_OK;
    }
  }

  private int validate(CliOptions options) {
    JdbcSessionFactory sessionFactory = sessionFactory();
    try (ConnectionManager manager = connectionManager(sessionFactory)) {
      MigrationRunner runner = runner(options, manager, sessionFactory);
      runner.validate();
      out.println("All migrations in " + runner.config().directory() + " are valid");
      return EXIT_OK;
    }
  }

  private int create(CliOptions options) {
    if (options.arguments().isEmpty()) {
      return usageError("create requires a migration name");
    }
    String name = String.join("_", options.arguments());
    JdbcSessionFactory sessionFactory = sessionFactory();
    try (ConnectionManager manager = connectionManager(sessionFactory)) {
      Path file = runner(options, manager, sessionFactory).createMigration(name);
      out.println("Created " + file);
      return EXIT_OK;
    }
  }

  void printStatus(MigrationStatus status) {
    String format = "%-8s %-40s %-8s %-28s %s%n";
    out.printf(format, "VERSION", "NAME", "STATUS", "EXECUTED AT", "CHECKSUM");
    for (MigrationRecord record : status.applied()) {
      String state = status.drifted().contains(record.id()) ? "drifted" : "applied";
      out.printf(format, String.format("%03d", record.version()), record.name(), state,
          record.executedAt(), shortChecksum(record.checksum()));
    }
    for (Migration migration : status.pending()) {
      out.printf(format, String.format("%03d", migration.version()), migration.name(), "pending", "-",
          shortChecksum(migration.checksum()));
    }
    out.println();
    out.println(status.summary());
    if (!status.drifted().isEmpty()) {
      out.println("Checksum drift: " + String.join(", ", status.drifted()));
    }
  }

  private JdbcSessionFactory sessionFactory() {
    String url = env.getOrDefault(ENV_URL, DEFAULT_URL);
    return JdbcSessionFactory.builder()
        .jdbcUrl(url)
        .dialect(Dialects.resolve(env.get(ENV_DIALECT), url))
        .username(env.getOrDefault(ENV_USERNAME, DEFAULT_USERNAME))
        .password(env.getOrDefault(ENV_PASSWORD, DEFAULT_PASSWORD))
        .database(env.get(ENV_DATABASE))
        .build();
  }

  private static ConnectionManager connectionManager(JdbcSessionFactory sessionFactory) {
    return ConnectionManager.builder()
        .sessionFactory(sessionFactory)
        .errorClassifier(sessionFactory.dialect().errorClassifier())
        .name("migrate")
        .maxConnections(1)
        .build();
  }

  private static MigrationRunner runner(CliOptions options, ConnectionManager manager,
      JdbcSessionFactory sessionFactory) {
    MigrationConfig config = MigrationConfig.builder()
        .directory(options.migrations())
        .serviceName(options.serviceName())
        .timeout(options.timeout())
        .dryRun(options.dryRun())
        .build();
    return new MigrationRunner(manager, sessionFactory.dialect(), config);
  }

  private int usageError(String message) {
    err.println("error: " + message);
    err.println();
    printUsage(err);
    return EXIT_USAGE;
  }

  private static void printUsage(PrintStream stream) {
    stream.println("Usage: migrate <command> [flags]");
    stream.println();
    stream.println("Commands:");
    stream.println("  up              apply pending migrations");
    stream.println("  status          list applied and pending migrations");
    stream.println("  validate        check migration files without connecting");
    stream.println("  create <name>   write a new migration skeleton");
    stream.println("  version         print build information");
    stream.println("  help            print this message");
    stream.println();
    stream.println("Flags:");
    stream.println("  --dry-run             with up, list what would run without applying it");
    stream.println("  --migrations <dir>    migrations directory (default ./migrations)");
    stream.println("  --service <name>      service owning the ledger table (default ledger)");
    stream.println("  --timeout <duration>  connect and per-script timeout, e.g. 30s or 2m (default 30s)");
    stream.println("  -v, --verbose         debug logging");
    stream.println();
    stream.println("Environment:");
    stream.println("  " + ENV_URL + "    (default " + DEFAULT_URL + ")");
    stream.println("  " + ENV_USERNAME + ", " + ENV_PASSWORD + ", " + ENV_DATABASE);
  }

  private static String shortChecksum(String checksum) {
    return checksum.length() > CHECKSUM_PREFIX ? checksum.substring(0, CHECKSUM_PREFIX) : checksum;
  }

  private static void enableVerboseLogging() {
    Logger root = LogManager.getLogManager().getLogger("");
    root.setLevel(Level.FINE);
    for (Handler handler : root.getHandlers()) {
      handler.setLevel(Level.FINE);
    }
  }
}

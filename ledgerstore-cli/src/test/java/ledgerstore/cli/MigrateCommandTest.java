package ledgerstore.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrateCommandTest {

  @TempDir
  Path migrations;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private MigrateCommand command;

  @BeforeEach
  void setUp() throws IOException {
    Files.writeString(migrations.resolve("001_create_accounts.sql"),
        "CREATE TABLE IF NOT EXISTS accounts (id VARCHAR(36) NOT NULL, name VARCHAR(255), PRIMARY KEY (id));\n");
    Files.writeString(migrations.resolve("002_add_lookup_table.sql"),
        "CREATE TABLE IF NOT EXISTS lookups (id VARCHAR(36) NOT NULL, PRIMARY KEY (id));\n");
    command = commandFor("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
  }

  @Test
  void versionPrintsBuildInfo() {
    assertEquals(0, command.run("version"));
    assertTrue(stdout().contains("1.2.3"));
    assertTrue(stdout().contains("abc1234"));
  }

  @Test
  void helpWithoutCommand() {
    assertEquals(0, command.run());
    assertTrue(stdout().contains("Usage: migrate"));
  }

  @Test
  void unknownCommandIsUsageError() {
    assertEquals(2, command.run("downgrade"));
    assertTrue(stderr().contains("unknown command: downgrade"));
  }

  @Test
  void unknownFlagIsUsageError() {
    assertEquals(2, command.run("up", "--force"));
  }

  @Test
  void upAppliesPendingMigrationsAndStatusReportsThem() {
    assertEquals(0, command.run("up", "--migrations", migrations.toString()));
    assertTrue(stdout().contains("Applied 001_create_accounts"));
    assertTrue(stdout().contains("Applied 2 migration(s)"));

    out.reset();
    assertEquals(0, command.run("status", "--migrations", migrations.toString()));
    assertTrue(stdout().contains("All 2 migrations applied"));
    assertTrue(stdout().contains("applied"));

    out.reset();
    assertEquals(0, command.run("up", "--migrations", migrations.toString()));
    assertTrue(stdout().contains("No pending migrations"));
  }

  @Test
  void dryRunAppliesNothing() {
    assertEquals(0, command.run("up", "--dry-run", "--migrations", migrations.toString()));
    assertTrue(stdout().contains("Dry run: 2 migration(s) would be applied"));

    out.reset();
    assertEquals(0, command.run("status", "--migrations", migrations.toString()));
    assertTrue(stdout().contains("0 applied, 2 pending"));
  }

  @Test
  void failingMigrationExitsNonZero() throws IOException {
    Files.writeString(migrations.resolve("003_broken.sql"), "CREATE TABLE broken (id NOT_A_TYPE);\n");
    assertEquals(1, command.run("up", "--migrations", migrations.toString()));
    assertTrue(stderr().startsWith("error:"));
  }

  @Test
  void validatePassesWithoutConnecting() {
    MigrateCommand unreachable = commandFor("jdbc:postgresql://127.0.0.1:1/defaultdb");
    assertEquals(0, unreachable.run("validate", "--migrations", migrations.toString()));
    assertTrue(stdout().contains("are valid"));
  }

  @Test
  void validateReportsEveryProblem() throws IOException {
    Files.writeString(migrations.resolve("004_drop_lookups.sql"), "DROP TABLE lookups;\n");
    assertEquals(1, command.run("validate", "--migrations", migrations.toString()));
    assertTrue(stderr().contains("migration sequence gap"));
    assertTrue(stderr().contains("destructive statement"));
  }

  @Test
  void createWritesNextSkeleton() {
    assertEquals(0, command.run("create", "Add", "Ledger-Index", "--migrations", migrations.toString()));
    assertTrue(Files.exists(migrations.resolve("003_add_ledger_index.sql")));
    assertTrue(stdout().contains("003_add_ledger_index.sql"));
  }

  @Test
  void createWithoutNameIsUsageError() {
    assertEquals(2, command.run("create", "--migrations", migrations.toString()));
  }

  @Test
  void createWithUnusableNameFails() {
    assertEquals(1, command.run("create", "!!!", "--migrations", migrations.toString()));
    assertFalse(stdout().contains("Created"));
  }

  @Test
  void unreachableStoreExitsNonZero() {
    MigrateCommand unreachable = commandFor("jdbc:h2:tcp://127.0.0.1:1/mem:unreachable");
    assertEquals(1, unreachable.run("status", "--timeout", "1s", "--migrations", migrations.toString()));
    assertTrue(stderr().contains("UNAVAILABLE"));
  }

  @Test
  void configuredDialectOverridesUrlDetection() {
    String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    MigrateCommand unknown = commandWith(url, "sqlite");
    assertEquals(1, unknown.run("status", "--migrations", migrations.toString()));
    assertTrue(stderr().contains("Unknown dialect 'sqlite'"));

    MigrateCommand h2 = commandWith(url, "H2");
    assertEquals(0, h2.run("up", "--migrations", migrations.toString()));
    assertTrue(stdout().contains("Applied 2 migration(s)"));
  }

  private MigrateCommand commandWith(String url, String dialect) {
    return new MigrateCommand(
        Map.of(MigrateCommand.ENV_URL, url, MigrateCommand.ENV_USERNAME, "sa", MigrateCommand.ENV_PASSWORD, "",
            MigrateCommand.ENV_DIALECT, dialect),
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8),
        new BuildInfo("1.2.3", "abc1234", "main"));
  }

  private MigrateCommand commandFor(String url) {
    return new MigrateCommand(
        Map.of(MigrateCommand.ENV_URL, url, MigrateCommand.ENV_USERNAME, "sa", MigrateCommand.ENV_PASSWORD, ""),
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8),
        new BuildInfo("1.2.3", "abc1234", "main"));
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }
}

package ledgerstore.jdbc.migration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

import ledgerstore.jdbc.TableNames;

/**
 * Settings for {@link MigrationRunner}.
 *
 * <p>Defaults: directory {@code ./migrations}, service {@code ledger}, ledger table
 * {@code ledger_schema_migrations}, 30 second timeout per script, index targets verified
 * empty, destructive statements rejected.
 */
public final class MigrationConfig {
  private final Path directory;
  private final String serviceName;
  private final String tableName;
  private final Duration timeout;
  private final boolean dryRun;
  private final boolean runOnBoot;
  private final boolean verifyIndexTargetsEmpty;
  private final boolean allowDestructive;
  private final String appliedBy;

  private MigrationConfig(Builder builder) {
    this.directory = builder.directory;
    this.serviceName = builder.serviceName;
    this.tableName = builder.tableName != null
        ? TableNames.validate(builder.tableName)
        : TableNames.migrationLedger(builder.serviceName);
    this.timeout = builder.timeout;
    this.dryRun = builder.dryRun;
    this.runOnBoot = builder.runOnBoot;
    this.verifyIndexTargetsEmpty = builder.verifyIndexTargetsEmpty;
    this.allowDestructive = builder.allowDestructive;
    this.appliedBy = builder.appliedBy;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Path directory() {
    return directory;
  }

  public String serviceName() {
    return serviceName;
  }

  public String tableName() {
    return tableName;
  }

  public Duration timeout() {
    return timeout;
  }

  public boolean dryRun() {
    return dryRun;
  }

  public boolean runOnBoot() {
    return runOnBoot;
  }

  public boolean verifyIndexTargetsEmpty() {
    return verifyIndexTargetsEmpty;
  }

  public boolean allowDestructive() {
    return allowDestructive;
  }

  public String appliedBy() {
    return appliedBy;
  }

  public static final class Builder {
    private Path directory = Path.of("migrations");
    private String serviceName = "ledger";
    private String tableName;
    private Duration timeout = Duration.ofSeconds(30);
    private boolean dryRun;
    private boolean runOnBoot;
    private boolean verifyIndexTargetsEmpty = true;
    private boolean allowDestructive;
    private String appliedBy = System.getProperty("user.name", "ledgerstore");

    private Builder() {
    }

    public Builder directory(Path directory) {
      this.directory = Objects.requireNonNull(directory, "directory");
      return this;
    }

    /**
     * Service owning the ledger; the ledger table is {@code <service>_schema_migrations}.
     */
    public Builder serviceName(String serviceName) {
      this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
      return this;
    }

    /**
     * Overrides the derived ledger table name.
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = Objects.requireNonNull(timeout, "timeout");
      return this;
    }

    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public Builder runOnBoot(boolean runOnBoot) {
      this.runOnBoot = runOnBoot;
      return this;
    }

    public Builder verifyIndexTargetsEmpty(boolean verifyIndexTargetsEmpty) {
      this.verifyIndexTargetsEmpty = verifyIndexTargetsEmpty;
      return this;
    }

    public Builder allowDestructive(boolean allowDestructive) {
      this.allowDestructive = allowDestructive;
      return this;
    }

    public Builder appliedBy(String appliedBy) {
      this.appliedBy = Objects.requireNonNull(appliedBy, "appliedBy");
      return this;
    }

    public MigrationConfig build() {
      if (serviceName.isBlank()) {
        throw new IllegalArgumentException("serviceName must not be blank");
      }
      if (timeout.isNegative() || timeout.isZero()) {
        throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
      }
      return new MigrationConfig(this);
    }
  }
}

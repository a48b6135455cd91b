package ledgerstore.jdbc;

import java.util.Objects;

/**
 * Table name conventions and validation.
 */
public final class TableNames {
  public static final String ACCOUNTS = "accounts";
  public static final String MIGRATION_LEDGER_SUFFIX = "_schema_migrations";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /** Validates a table name that may carry one {@code schema.} prefix. */
  public static String validateQualified(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    int dot = tableName.indexOf('.');
    if (dot < 0) {
      return validate(tableName);
    }
    String schema = tableName.substring(0, dot);
    String table = tableName.substring(dot + 1);
    if (!schema.matches(TABLE_NAME_PATTERN) || !table.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /**
   * Ledger table for a service, {@code <service>_schema_migrations}.
   */
  public static String migrationLedger(String serviceName) {
    Objects.requireNonNull(serviceName, "serviceName");
    return validate(serviceName + MIGRATION_LEDGER_SUFFIX);
  }
}

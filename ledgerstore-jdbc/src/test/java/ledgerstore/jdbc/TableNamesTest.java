package ledgerstore.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void acceptsPlainIdentifiers() {
    assertEquals("accounts", TableNames.validate("accounts"));
    assertEquals("_ledger2", TableNames.validate("_ledger2"));
  }

  @Test
  void rejectsInjection() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("accounts; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1accounts"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }

  @Test
  void acceptsOneSchemaPrefix() {
    assertEquals("public.accounts", TableNames.validateQualified("public.accounts"));
    assertEquals("accounts", TableNames.validateQualified("accounts"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validateQualified("a.b.c"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validateQualified("public.accounts;--"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validateQualified(".accounts"));
  }

  @Test
  void derivesMigrationLedgerName() {
    assertEquals("ledger_schema_migrations", TableNames.migrationLedger("ledger"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.migrationLedger("my-service"));
  }
}

/**
 * Append-only schema migrations: script discovery and checks, the per-service ledger
 * table, the runner and its health probe.
 *
 * @see ledgerstore.jdbc.migration.MigrationRunner
 */
package ledgerstore.jdbc.migration;

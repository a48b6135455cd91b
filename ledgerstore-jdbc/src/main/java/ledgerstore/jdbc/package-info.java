/**
 * JDBC implementation: sessions, dialects, versioned repositories and schema migrations.
 *
 * @see ledgerstore.jdbc.JdbcSessionFactory
 * @see ledgerstore.jdbc.repository.JdbcAccountRepository
 * @see ledgerstore.jdbc.migration.MigrationRunner
 */
package ledgerstore.jdbc;

/**
 * Service provider interfaces for pluggable session, session-source and metrics implementations.
 *
 * @see ledgerstore.spi.SessionFactory
 * @see ledgerstore.spi.SessionProvider
 * @see ledgerstore.spi.MetricsExporter
 */
package ledgerstore.spi;

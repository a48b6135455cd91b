/**
 * Dependency health reports and the probes that produce them.
 *
 * @see ledgerstore.health.DependencyHealth
 * @see ledgerstore.health.ConnectionHealthChecker
 */
package ledgerstore.health;

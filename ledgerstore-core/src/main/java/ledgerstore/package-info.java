/**
 * Store session lifecycle: connect with backoff, health checks with transparent reconnect,
 * session leases and statistics.
 *
 * @see ledgerstore.ConnectionManager
 * @see ledgerstore.Deadline
 */
package ledgerstore;

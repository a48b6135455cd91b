package ledgerstore.health;

/**
 * Connection pool snapshot attached to a database health report.
 */
public record PoolInfo(int maxConnections, int activeConnections, int idleConnections) {
  public PoolInfo {
    if (maxConnections < 0 || activeConnections < 0 || idleConnections < 0) {
      throw new IllegalArgumentException("pool counts must be >= 0");
    }
  }
}

package ledgerstore.health;

/**
 * Health of one dependency as reported to the health service.
 */
public enum HealthStatus {
  HEALTHY,
  /** Usable with reduced functionality, or needs operator attention. */
  DEGRADED,
  UNHEALTHY;

  public boolean isHealthy() {
    return this == HEALTHY;
  }
}

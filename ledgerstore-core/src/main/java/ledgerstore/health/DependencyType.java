package ledgerstore.health;

/**
 * Category of a dependency in a health report.
 */
public enum DependencyType {
  DATABASE,
  CACHE,
  MESSAGE_QUEUE,
  EXTERNAL_API
}

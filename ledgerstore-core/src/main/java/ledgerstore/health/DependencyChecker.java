package ledgerstore.health;

import ledgerstore.Deadline;

/**
 * Produces a health report for one dependency on demand.
 */
public interface DependencyChecker {

  String name();

  /**
   * Checks the dependency. Implementations report failures in the returned value rather than
   * throwing.
   */
  DependencyHealth check(Deadline deadline);
}

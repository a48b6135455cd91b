package ledgerstore.jdbc.migration;

import java.util.List;

/**
 * Thrown when migrations cannot be loaded, validated or applied.
 */
public class MigrationException extends RuntimeException {
  private final List<String> problems;

  public MigrationException(String message) {
    this(message, List.of(), null);
  }

  public MigrationException(String message, Throwable cause) {
    this(message, List.of(), cause);
  }

  public MigrationException(String message, List<String> problems) {
    this(message, problems, null);
  }

  private MigrationException(String message, List<String> problems, Throwable cause) {
    super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems), cause);
    this.problems = List.copyOf(problems);
  }

  /**
   * Individual findings when validation failed; empty for other failures.
   */
  public List<String> problems() {
    return problems;
  }
}

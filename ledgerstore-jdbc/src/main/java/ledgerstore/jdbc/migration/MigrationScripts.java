package ledgerstore.jdbc.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reading, splitting and checking migration scripts. Nothing here touches the store.
 *
 * <p>Scripts are named {@code NNN_description.sql}, where {@code NNN} is a zero-padded
 * sequence number of at least three digits.
 */
public final class MigrationScripts {
  private static final Logger logger = Logger.getLogger(MigrationScripts.class.getName());

  static final Pattern FILE_NAME = Pattern.compile("^(\\d{3,})_([A-Za-z0-9_]+)\\.sql$");

  private static final Pattern CREATE_INDEX = Pattern.compile(
      "^CREATE\\s+(?:UNIQUE\\s+)?INDEX\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(?:[A-Za-z0-9_\"]+\\s+)?ON\\s+"
          + "(?:\"?([A-Za-z0-9_]+)\"?\\.)?\"?([A-Za-z0-9_]+)\"?",
      Pattern.CASE_INSENSITIVE);

  private static final Pattern CREATE_TABLE = Pattern.compile("^CREATE\\s+TABLE\\s+", Pattern.CASE_INSENSITIVE);

  private static final Pattern CREATE_TABLE_IF_NOT_EXISTS = Pattern.compile(
      "^CREATE\\s+TABLE\\s+IF\\s+NOT\\s+EXISTS\\s+", Pattern.CASE_INSENSITIVE);

  private static final Pattern DESTRUCTIVE = Pattern.compile(
      "^(?:DROP\\s|DELETE\\s|UPDATE\\s|TRUNCATE\\s|ALTER\\s+TABLE\\s.*\\b(?:DROP|RENAME|MODIFY)\\b"
          + "|ALTER\\s+TABLE\\s.*\\bALTER\\s+COLUMN\\b)",
      Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final Set<String> KNOWN_KEYWORDS = Set.of(
      "CREATE", "ALTER", "INSERT", "UPSERT", "UPDATE", "DELETE", "DROP", "SELECT", "WITH",
      "GRANT", "REVOKE", "COMMENT", "SET", "TRUNCATE", "BEGIN", "COMMIT");

  private MigrationScripts() {}

  /**
   * Loads every well-named script in {@code directory}, ascending by version. Files with
   * a {@code .sql} suffix but a malformed name are skipped with a warning.
   *
   * @throws MigrationException if the directory is missing or unreadable
   */
  public static List<Migration> load(Path directory) {
    List<Migration> migrations = new ArrayList<>();
    for (Path file : sqlFiles(directory)) {
      String fileName = file.getFileName().toString();
      Matcher m = FILE_NAME.matcher(fileName);
      if (!m.matches()) {
        logger.warning("Skipping migration file with invalid name: " + fileName);
        continue;
      }
      String content = read(file);
      migrations.add(new Migration(Integer.parseInt(m.group(1)), m.group(2), file, content, checksum(content)));
    }
    migrations.sort(Comparator.comparingInt(Migration::version).thenComparing(Migration::name));
    return migrations;
  }

  /**
   * Names of {@code .sql} files in {@code directory} that do not follow {@code NNN_description.sql}.
   */
  public static List<String> invalidFileNames(Path directory) {
    List<String> invalid = new ArrayList<>();
    for (Path file : sqlFiles(directory)) {
      String fileName = file.getFileName().toString();
      if (!FILE_NAME.matcher(fileName).matches()) {
        invalid.add(fileName);
      }
    }
    return invalid;
  }

  /**
   * Sequence problems in a version-sorted list: duplicates, and gaps in the run 1, 2, 3...
   */
  public static List<String> sequenceProblems(List<Migration> sorted) {
    List<String> problems = new ArrayList<>();
    int expected = 1;
    Migration previous = null;
    for (Migration migration : sorted) {
      if (previous != null && previous.version() == migration.version()) {
        problems.add("duplicate migration version " + migration.version() + ": "
            + previous.path().getFileName() + " and " + migration.path().getFileName());
        continue;
      }
      if (migration.version() != expected) {
        problems.add("migration sequence gap: expected version " + expected + ", found "
            + migration.path().getFileName());
      }
      expected = migration.version() + 1;
      previous = migration;
    }
    return problems;
  }

  /** SHA-256 of the script text, lower-case hex. */
  public static String checksum(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Splits a script into statements on semicolons outside quoted literals. Line
   * ({@code --}) and block comments are removed; empty statements are dropped.
   *
   * @throws MigrationException on an unterminated literal or block comment
   */
  public static List<String> splitStatements(String script) {
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int length = script.length();
    int i = 0;
    while (i < length) {
      char c = script.charAt(i);
      char next = i + 1 < length ? script.charAt(i + 1) : '\0';
      if (c == '\'' || c == '"') {
        int end = script.indexOf(c, i + 1);
        if (end < 0) {
          throw new MigrationException("unterminated " + (c == '\'' ? "string literal" : "quoted identifier"));
        }
        current.append(script, i, end + 1);
        i = end + 1;
      } else if (c == '-' && next == '-') {
        int end = script.indexOf('\n', i);
        i = end < 0 ? length : end;
      } else if (c == '/' && next == '*') {
        int end = script.indexOf("*/", i + 2);
        if (end < 0) {
          throw new MigrationException("unterminated block comment");
        }
        current.append(' ');
        i = end + 2;
      } else if (c == ';') {
        addStatement(statements, current);
        i++;
      } else {
        current.append(c);
        i++;
      }
    }
    addStatement(statements, current);
    return statements;
  }

  /**
   * Basic syntax sanity for one script: it must split cleanly, contain at least one
   * statement, balance parentheses, and start every statement with a known SQL keyword.
   */
  public static List<String> syntaxProblems(Migration migration) {
    List<String> problems = new ArrayList<>();
    String file = migration.path().getFileName().toString();
    List<String> statements;
    try {
      statements = splitStatements(migration.content());
    } catch (MigrationException e) {
      problems.add(file + ": " + e.getMessage());
      return problems;
    }
    if (statements.isEmpty()) {
      problems.add(file + ": contains no statements");
    }
    for (int n = 0; n < statements.size(); n++) {
      String statement = statements.get(n);
      String keyword = firstKeyword(statement);
      if (!KNOWN_KEYWORDS.contains(keyword)) {
        problems.add(file + ": statement " + (n + 1) + " starts with unrecognized keyword '" + keyword + "'");
      }
      if (!parenthesesBalanced(statement)) {
        problems.add(file + ": statement " + (n + 1) + " has unbalanced parentheses");
      }
    }
    return problems;
  }

  /** Statements that remove or rewrite existing data or columns. */
  public static List<String> destructiveStatements(List<String> statements) {
    return statements.stream()
        .filter(s -> DESTRUCTIVE.matcher(s).find())
        .toList();
  }

  /** Statements that create a table without {@code IF NOT EXISTS}. */
  public static List<String> nonIdempotentCreates(List<String> statements) {
    return statements.stream()
        .filter(s -> CREATE_TABLE.matcher(s).find() && !CREATE_TABLE_IF_NOT_EXISTS.matcher(s).find())
        .toList();
  }

  /**
   * Table an index statement targets, if the statement creates an index. A schema-qualified
   * target is returned as {@code schema.table} without quotes.
   */
  public static Optional<String> indexTarget(String statement) {
    Matcher m = CREATE_INDEX.matcher(statement);
    if (!m.find()) {
      return Optional.empty();
    }
    return Optional.of(m.group(1) == null ? m.group(2) : m.group(1) + "." + m.group(2));
  }

  /**
   * Reduces a free-form name to {@code [a-z0-9_]}: spaces and hyphens become underscores,
   * other characters are dropped.
   *
   * @return the sanitized name, empty if nothing usable remained
   */
  public static String sanitizeName(String name) {
    StringBuilder sb = new StringBuilder();
    for (char c : name.trim().toCharArray()) {
      if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_') {
        sb.append(Character.toLowerCase(c));
      } else if (c == ' ' || c == '-') {
        sb.append('_');
      }
    }
    return sb.toString().replaceAll("_+", "_").replaceAll("^_|_$", "");
  }

  /** Next free version in {@code directory}, 1 when there are no scripts yet. */
  public static int nextVersion(Path directory) {
    if (!Files.isDirectory(directory)) {
      return 1;
    }
    return load(directory).stream().mapToInt(Migration::version).max().orElse(0) + 1;
  }

  /** Skeleton for a new script. */
  static String template(String fileId, String serviceName, String author, Instant createdAt) {
    return "-- Migration: " + fileId + "\n"
        + "-- Service: " + serviceName + "\n"
        + "-- Author: " + author + "\n"
        + "-- Created: " + createdAt + "\n"
        + "-- Description: \n"
        + "--\n"
        + "-- The store is append-only. Applied migrations can never be rolled back, so:\n"
        + "--   use CREATE TABLE IF NOT EXISTS\n"
        + "--   never drop, rename or retype existing columns\n"
        + "--   create indexes only on tables that are still empty\n"
        + "\n";
  }

  private static void addStatement(List<String> statements, StringBuilder current) {
    String statement = current.toString().trim();
    if (!statement.isEmpty()) {
      statements.add(statement);
    }
    current.setLength(0);
  }

  private static String firstKeyword(String statement) {
    int end = 0;
    while (end < statement.length() && Character.isLetter(statement.charAt(end))) {
      end++;
    }
    return statement.substring(0, end).toUpperCase(Locale.ROOT);
  }

  private static boolean parenthesesBalanced(String statement) {
    int depth = 0;
    char quote = 0;
    for (char c : statement.toCharArray()) {
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        if (--depth < 0) {
          return false;
        }
      }
    }
    return depth == 0;
  }

  private static List<Path> sqlFiles(Path directory) {
    if (!Files.isDirectory(directory)) {
      throw new MigrationException("migrations directory not found: " + directory.toAbsolutePath());
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(".sql"))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new MigrationException("failed to list migrations directory " + directory, e);
    }
  }

  private static String read(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new MigrationException("failed to read migration " + file, e);
    }
  }
}

package ledgerstore.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed command line: one command, its positional arguments, and the shared flags.
 *
 * @param command     the command word, lower-cased; {@code help} when none was given
 * @param arguments   positional arguments after the command
 * @param dryRun      {@code --dry-run}
 * @param migrations  {@code --migrations <dir>}
 * @param serviceName {@code --service <name>}
 * @param timeout     {@code --timeout <duration>}, per script and for the connect
 * @param verbose     {@code --verbose} / {@code -v}
 */
public record CliOptions(
    String command,
    List<String> arguments,
    boolean dryRun,
    Path migrations,
    String serviceName,
    Duration timeout,
    boolean verbose
) {

  static final Path DEFAULT_MIGRATIONS = Path.of("migrations");
  static final String DEFAULT_SERVICE = "ledger";
  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public CliOptions {
    Objects.requireNonNull(command, "command");
    arguments = List.copyOf(arguments);
    Objects.requireNonNull(migrations, "migrations");
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Parses {@code args}. Flags may appear before or after the command.
   *
   * @throws IllegalArgumentException on an unknown flag or a flag missing its value
   */
  public static CliOptions parse(String... args) {
    String command = null;
    List<String> arguments = new ArrayList<>();
    boolean dryRun = false;
    Path migrations = DEFAULT_MIGRATIONS;
    String service = DEFAULT_SERVICE;
    Duration timeout = DEFAULT_TIMEOUT;
    boolean verbose = false;

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String inlineValue = null;
      if (arg.startsWith("--") && arg.contains("=")) {
        inlineValue = arg.substring(arg.indexOf('=') + 1);
        arg = arg.substring(0, arg.indexOf('='));
      }
      switch (arg) {
        case "--dry-run" -> dryRun = true;
        case "--verbose", "-v" -> verbose = true;
        case "--help", "-h" -> command = "help";
        case "--migrations", "-m" -> {
          String value = inlineValue != null ? inlineValue : next(args, ++i, arg);
          migrations = Path.of(value);
        }
        case "--service" -> service = requireText(inlineValue != null ? inlineValue : next(args, ++i, arg), arg);
        case "--timeout" -> timeout = parseDuration(inlineValue != null ? inlineValue : next(args, ++i, arg));
        default -> {
          if (arg.startsWith("-")) {
            throw new IllegalArgumentException("unknown flag: " + arg);
          }
          if (command == null) {
            command = arg.toLowerCase(Locale.ROOT);
          } else {
            arguments.add(arg);
          }
        }
      }
    }
    return new CliOptions(command == null ? "help" : command, arguments, dryRun, migrations, service,
        timeout, verbose);
  }

  /**
   * Accepts {@code 30s}, {@code 2m}, {@code 1h}, {@code 500ms}, a bare number of seconds, or
   * an ISO-8601 duration such as {@code PT30S}.
   */
  static Duration parseDuration(String text) {
    String value = text.trim().toLowerCase(Locale.ROOT);
    try {
      Duration duration;
      if (value.startsWith("pt") || value.startsWith("p")) {
        duration = Duration.parse(value.toUpperCase(Locale.ROOT));
      } else if (value.endsWith("ms")) {
        duration = Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
      } else if (value.endsWith("s")) {
        duration = Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1)));
      } else if (value.endsWith("m")) {
        duration = Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1)));
      } else if (value.endsWith("h")) {
        duration = Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1)));
      } else {
        duration = Duration.ofSeconds(Long.parseLong(value));
      }
      if (duration.isNegative() || duration.isZero()) {
        throw new IllegalArgumentException("timeout must be positive: " + text);
      }
      return duration;
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException("invalid duration: " + text, e);
    }
  }

  private static String next(String[] args, int index, String flag) {
    if (index >= args.length) {
      throw new IllegalArgumentException(flag + " requires a value");
    }
    return args[index];
  }

  private static String requireText(String value, String flag) {
    if (value.isBlank()) {
      throw new IllegalArgumentException(flag + " requires a value");
    }
    return value;
  }
}

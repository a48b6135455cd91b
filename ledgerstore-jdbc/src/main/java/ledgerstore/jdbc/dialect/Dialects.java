package ledgerstore.jdbc.dialect;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

import javax.sql.DataSource;

import ledgerstore.jdbc.spi.Dialect;

/**
 * ServiceLoader-backed lookup of the SQL dialect for a store.
 *
 * <p>A configured dialect name always wins over detection; the CLI and the Spring starter both
 * go through {@link #resolve(String, String)}. Names are case-insensitive and accept the
 * common aliases {@code postgres} and {@code mariadb}.
 */
public final class Dialects {

  private static final Map<String, String> ALIASES = Map.of(
      "postgres", "postgresql",
      "pg", "postgresql",
      "mariadb", "mysql");

  private static final List<Dialect> REGISTERED = ServiceLoader.load(Dialect.class).stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private static final Map<String, Dialect> BY_NAME = indexByName(REGISTERED);

  private Dialects() {
  }

  public static List<Dialect> all() {
    return REGISTERED;
  }

  /**
   * @throws IllegalArgumentException if neither the name nor an alias is registered
   */
  public static Dialect get(String name) {
    return find(name).orElseThrow(() -> new IllegalArgumentException(
        "Unknown dialect '" + name + "'; known dialects: " + BY_NAME.keySet()));
  }

  /**
   * Picks the dialect for a connection setting: {@code configuredName} when it is set,
   * otherwise the one detected from {@code jdbcUrl}.
   */
  public static Dialect resolve(String configuredName, String jdbcUrl) {
    if (configuredName != null && !configuredName.isBlank()) {
      return get(configuredName.trim());
    }
    return detect(jdbcUrl);
  }

  /**
   * Detects the dialect of a pooled data source. The connection URL is tried first; URLs of
   * wrapping drivers fall back to the product name in the connection metadata.
   *
   * @throws IllegalStateException if no connection can be obtained or nothing matches
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      DatabaseMetaData meta = conn.getMetaData();
      String url = meta.getURL();
      Optional<Dialect> byUrl = byUrl(url);
      if (byUrl.isPresent()) {
        return byUrl.get();
      }
      String product = meta.getDatabaseProductName();
      return find(product).orElseThrow(() -> new IllegalStateException(
          "No dialect for data source (url=" + url + ", product=" + product + ")"));
    } catch (SQLException e) {
      throw new IllegalStateException("Cannot open a connection to detect the store dialect", e);
    }
  }

  /**
   * @throws IllegalArgumentException if the URL is blank or no dialect claims its prefix
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("JDBC URL is required to detect the store dialect");
    }
    return byUrl(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect handles " + jdbcUrl + "; set the dialect explicitly (known: " + BY_NAME.keySet() + ")"));
  }

  private static Optional<Dialect> byUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return REGISTERED.stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(url::startsWith))
        .findFirst();
  }

  private static Optional<Dialect> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.toLowerCase(Locale.ROOT);
    return Optional.ofNullable(BY_NAME.get(ALIASES.getOrDefault(key, key)));
  }

  private static Map<String, Dialect> indexByName(List<Dialect> dialects) {
    Map<String, Dialect> byName = new LinkedHashMap<>();
    for (Dialect dialect : dialects) {
      byName.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
    return byName;
  }
}

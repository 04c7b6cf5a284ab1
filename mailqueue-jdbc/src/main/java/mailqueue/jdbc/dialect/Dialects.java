package mailqueue.jdbc.dialect;

import mailqueue.jdbc.ConnectionProvider;
import mailqueue.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * The dialects found on the class path through {@code META-INF/services/mailqueue.jdbc.spi.Dialect}.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(connectionProvider);
 * Dialect dialect = Dialects.detect("jdbc:postgresql://localhost/mail");
 * Dialect dialect = Dialects.get("mysql");
 * }</pre>
 */
public final class Dialects {

  private static final Map<String, Dialect> REGISTRY = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> registry = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      Dialect previous = registry.putIfAbsent(key(dialect.name()), dialect);
      if (previous != null) {
        throw new IllegalStateException("Dialect name '" + dialect.name() + "' registered by both "
            + previous.getClass().getName() + " and " + dialect.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(registry);
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  public static List<Dialect> all() {
    return List.copyOf(REGISTRY.values());
  }

  /**
   * Looks a dialect up by name, ignoring case.
   *
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = REGISTRY.get(key(name));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect '" + name + "', known: " + REGISTRY.keySet());
    }
    return dialect;
  }

  /**
   * Opens one connection and picks the dialect by its URL, or by the database product name
   * when no URL prefix matches.
   *
   * @throws IllegalStateException if no connection could be obtained
   * @throws IllegalArgumentException if neither the URL nor the product name is recognized
   */
  public static Dialect detect(ConnectionProvider connectionProvider) {
    String url;
    String product;
    try (Connection conn = connectionProvider.getConnection()) {
      DatabaseMetaData metaData = conn.getMetaData();
      url = metaData.getURL();
      product = metaData.getDatabaseProductName();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read database metadata for dialect detection", e);
    }
    return byUrl(url)
        .or(() -> byProduct(product))
        .orElseThrow(() -> new IllegalArgumentException(
            "No dialect for database '" + product + "' at " + url));
  }

  /**
   * Picks the dialect whose URL prefix matches {@code jdbcUrl}.
   *
   * @throws IllegalArgumentException if the URL is empty or no prefix matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return byUrl(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect for JDBC URL " + jdbcUrl + ", known prefixes: "
            + REGISTRY.values().stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList()));
  }

  private static Optional<Dialect> byUrl(String url) {
    if (url == null) {
      return Optional.empty();
    }
    return REGISTRY.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(url::startsWith))
        .findFirst();
  }

  private static Optional<Dialect> byProduct(String product) {
    if (product == null) {
      return Optional.empty();
    }
    return REGISTRY.values().stream()
        .filter(d -> d.productNames().stream().anyMatch(product::equalsIgnoreCase))
        .findFirst();
  }
}

package mailqueue.jdbc;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks the table name a {@link JdbcDocumentStore} is configured with. The name is spliced
 * unquoted into every statement, so it has to be a bare identifier that all supported
 * databases accept as is.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "mail_document";

  /** PostgreSQL truncates identifiers beyond this length; MySQL allows 64. */
  static final int MAX_LENGTH = 63;

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  // Keywords reserved in at least one of H2, MySQL and PostgreSQL that a queue table
  // plausibly ends up named after.
  private static final Set<String> RESERVED = Set.of(
      "all", "group", "order", "select", "table", "user", "values", "from", "where", "key");

  private TableNames() {}

  /**
   * Returns {@code tableName} unchanged if it is usable.
   *
   * @throws IllegalArgumentException if it is not a plain identifier, is too long, or is a
   *     reserved word
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: '" + tableName
          + "' (letters, digits and underscores only, not starting with a digit)");
    }
    if (tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Table name longer than " + MAX_LENGTH + " characters: " + tableName);
    }
    if (RESERVED.contains(tableName.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException("Table name is a reserved SQL word: " + tableName);
    }
    return tableName;
  }
}

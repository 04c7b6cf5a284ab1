package mailqueue.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Supplies JDBC connections to the document store.
 *
 * <p>Every call must return a connection the caller owns and closes. The store toggles
 * auto-commit on the connections it commits with and restores it before closing.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;

  /**
   * Borrows connections from a pool or any other {@link DataSource}.
   */
  static ConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}

package mailqueue.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the document store's parameterized statements on a borrowed connection.
 *
 * <p>Errors surface as {@link SQLException} so the store can tell conflicts from failures.
 * Parameters are bound positionally; {@link Instant} values are bound as timestamps.
 */
final class JdbcTemplate {

  @FunctionalInterface
  interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private JdbcTemplate() {}

  /** Returns the number of rows the statement changed. */
  static int execute(Connection conn, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    }
  }

  static <T> List<T> queryAll(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    List<T> rows = new ArrayList<>();
    try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        rows.add(mapper.map(rs));
      }
    }
    return rows;
  }

  /** Maps the first row, if any. Statements are keyed by primary key, so there is at most one. */
  static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
      return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
    }
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        Object param = params[i];
        if (param instanceof Instant instant) {
          ps.setTimestamp(i + 1, Timestamp.from(instant));
        } else if (param instanceof Long n) {
          ps.setLong(i + 1, n);
        } else {
          ps.setObject(i + 1, param);
        }
      }
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
    return ps;
  }
}

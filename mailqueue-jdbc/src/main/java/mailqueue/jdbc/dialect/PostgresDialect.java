package mailqueue.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {
  /** lock_not_available, raised when {@code lock_timeout} expires on a row lock. */
  private static final String LOCK_NOT_AVAILABLE = "55P03";

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean isConflict(SQLException e) {
    return LOCK_NOT_AVAILABLE.equals(e.getSQLState()) || super.isConflict(e);
  }
}

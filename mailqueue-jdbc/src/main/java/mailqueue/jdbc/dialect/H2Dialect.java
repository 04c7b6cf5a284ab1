package mailqueue.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 dialect, used by the tests and for embedded single-node setups.
 */
public final class H2Dialect extends AbstractDialect {
  // LOCK_TIMEOUT_1 carries SQLState HYT00; CONCURRENT_UPDATE_1 only has its vendor code.
  private static final String LOCK_TIMEOUT = "HYT00";
  private static final int CONCURRENT_UPDATE = 90131;

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public boolean isConflict(SQLException e) {
    if (LOCK_TIMEOUT.equals(e.getSQLState()) || e.getErrorCode() == CONCURRENT_UPDATE) {
      return true;
    }
    return super.isConflict(e);
  }
}

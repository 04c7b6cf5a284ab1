package mailqueue.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL dialect. Also covers TiDB and MariaDB, which speak the same protocol and error codes.
 */
public final class MySqlDialect extends AbstractDialect {
  private static final int ER_DUP_ENTRY = 1062;
  private static final int ER_LOCK_WAIT_TIMEOUT = 1205;
  private static final int ER_LOCK_DEADLOCK = 1213;

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public List<String> productNames() {
    return List.of("MySQL", "MariaDB");
  }

  @Override
  public boolean isConflict(SQLException e) {
    int code = e.getErrorCode();
    if (code == ER_DUP_ENTRY || code == ER_LOCK_WAIT_TIMEOUT || code == ER_LOCK_DEADLOCK) {
      return true;
    }
    return super.isConflict(e);
  }
}

package mailqueue.jdbc.dialect;

import mailqueue.jdbc.spi.Dialect;

import java.sql.SQLException;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  protected static final String COLUMNS = "collection_path, document_id, data, version, update_time";

  @Override
  public String schemaResource() {
    return "/mailqueue/jdbc/schema/" + name() + ".sql";
  }

  @Override
  public String selectSql(String table) {
    return "SELECT " + COLUMNS + " FROM " + table +
        " WHERE collection_path=? AND document_id=?";
  }

  @Override
  public String selectForUpdateSql(String table) {
    return selectSql(table) + " FOR UPDATE";
  }

  @Override
  public String listSql(String table) {
    return "SELECT " + COLUMNS + " FROM " + table +
        " WHERE collection_path=? ORDER BY document_id";
  }

  @Override
  public String insertSql(String table) {
    return "INSERT INTO " + table +
        " (collection_path, document_id, data, version, create_time, update_time)" +
        " VALUES (?,?,?,?,?,?)";
  }

  @Override
  public String updateSql(String table) {
    return "UPDATE " + table + " SET data=?, version=?, update_time=?" +
        " WHERE collection_path=? AND document_id=? AND version=?";
  }

  @Override
  public String deleteSql(String table) {
    return "DELETE FROM " + table +
        " WHERE collection_path=? AND document_id=? AND version=?";
  }

  /**
   * Unique violation ({@code 23505}) or any transaction rollback class ({@code 40xxx}).
   */
  @Override
  public boolean isConflict(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (state != null && (state.equals("23505") || state.startsWith("40"))) {
        return true;
      }
    }
    return false;
  }
}

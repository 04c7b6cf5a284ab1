package mailqueue.jdbc.spi;

import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific DDL and SQL for the document table.
 * Register custom dialects via {@code META-INF/services/mailqueue.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * <p>Every row-returning statement selects, in order: {@code collection_path, document_id,
 * data, version, update_time}.
 *
 * @see mailqueue.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Values of {@link java.sql.DatabaseMetaData#getDatabaseProductName()} this dialect handles,
   * compared ignoring case. Used when the JDBC URL is wrapped by a proxy driver.
   */
  default List<String> productNames() {
    return List.of(name());
  }

  /**
   * Classpath location of the DDL script. The script may contain several statements separated
   * by {@code ;} and uses {@code ${table}} for the table name.
   */
  String schemaResource();

  /**
   * SQL for reading one document.
   *
   * <p>Parameters: collection_path (String), document_id (String)
   */
  String selectSql(String table);

  /**
   * SQL for reading one document and locking its row until the enclosing transaction ends.
   *
   * <p>Parameters: collection_path (String), document_id (String)
   */
  String selectForUpdateSql(String table);

  /**
   * SQL for reading every document of a collection ordered by id.
   *
   * <p>Parameters: collection_path (String)
   */
  String listSql(String table);

  /**
   * SQL for inserting a new document.
   *
   * <p>Parameters: collection_path, document_id, data (String/JSON), version (long),
   * create_time (Timestamp), update_time (Timestamp)
   */
  String insertSql(String table);

  /**
   * SQL for replacing a document's data if its version is unchanged.
   *
   * <p>Parameters: data (String/JSON), version (long, new), update_time (Timestamp),
   * collection_path, document_id, version (long, expected)
   */
  String updateSql(String table);

  /**
   * SQL for deleting a document if its version is unchanged.
   *
   * <p>Parameters: collection_path, document_id, version (long, expected)
   */
  String deleteSql(String table);

  /**
   * Whether a failure means a concurrent transaction won (duplicate key, deadlock,
   * serialization failure, lock timeout) and the transaction should be re-run.
   */
  boolean isConflict(SQLException e);
}

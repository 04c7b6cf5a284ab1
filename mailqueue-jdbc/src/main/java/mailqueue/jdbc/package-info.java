/**
 * JDBC-backed {@link mailqueue.spi.DocumentStore}.
 *
 * <p>{@link mailqueue.jdbc.JdbcDocumentStore} keeps each document as a JSON row
 * ({@link mailqueue.jdbc.JacksonDocumentCodec}) and commits transactions with version-guarded
 * statements. Database specifics live in {@link mailqueue.jdbc.spi.Dialect} implementations:
 * H2, PostgreSQL and MySQL.
 *
 * @see mailqueue.jdbc.JdbcDocumentStore
 * @see mailqueue.jdbc.dialect.Dialects
 */
package mailqueue.jdbc;

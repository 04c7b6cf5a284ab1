package mailqueue.jdbc;

import mailqueue.jdbc.dialect.Dialects;
import mailqueue.jdbc.spi.Dialect;
import mailqueue.spi.DocumentChange;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.DocumentStoreException;
import mailqueue.spi.TransactionConflictException;
import mailqueue.store.AbstractDocumentStore;
import mailqueue.store.BufferedTransaction;
import mailqueue.store.ExponentialBackoffRetryPolicy;
import mailqueue.store.FieldPaths;
import mailqueue.store.RetryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Document store persisted in a single JDBC table, one row per document.
 *
 * <p>Transactions are optimistic. Reads inside a transaction use short auto-commit
 * connections. At commit, one database transaction locks every touched row in path order
 * ({@code SELECT ... FOR UPDATE}), verifies the versions the function saw, and writes with
 * version-guarded {@code UPDATE}/{@code DELETE} statements. A stale version, a duplicate key
 * on insert or a deadlock raises {@link TransactionConflictException}, and the function is
 * re-run by {@link AbstractDocumentStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcDocumentStore store = JdbcDocumentStore.builder()
 *     .connectionProvider(ConnectionProvider.of(dataSource))
 *     .build();
 * store.createSchema();
 * }</pre>
 */
public final class JdbcDocumentStore extends AbstractDocumentStore {
  private static final Logger logger = Logger.getLogger(JdbcDocumentStore.class.getName());

  private static final Comparator<DocumentRef> PATH_ORDER =
      Comparator.comparing(DocumentRef::collection).thenComparing(DocumentRef::id);

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String tableName;
  private final JacksonDocumentCodec codec;
  private final Clock clock;

  private final JdbcTemplate.RowMapper<DocumentSnapshot> rowMapper;

  private JdbcDocumentStore(Builder builder) {
    super(builder.retryPolicy, builder.maxAttempts);
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.dialect = builder.dialect != null ? builder.dialect : Dialects.detect(connectionProvider);
    this.tableName = TableNames.validate(builder.tableName);
    this.codec = Objects.requireNonNull(builder.codec, "codec");
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.rowMapper = rs -> new DocumentSnapshot(
        new DocumentRef(rs.getString("collection_path"), rs.getString("document_id")),
        codec.decode(rs.getString("data")),
        rs.getLong("version"),
        rs.getTimestamp("update_time").toInstant());
  }

  public static Builder builder() {
    return new Builder();
  }

  public Dialect dialect() {
    return dialect;
  }

  public String tableName() {
    return tableName;
  }

  /**
   * Creates the document table if it does not exist, using the dialect's schema script.
   */
  public void createSchema() {
    String script = loadSchema(dialect.schemaResource()).replace("${table}", tableName);
    try (Connection conn = connectionProvider.getConnection();
         Statement statement = conn.createStatement()) {
      for (String sql : script.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          statement.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new DocumentStoreException("Failed to create schema for table " + tableName, e);
    }
    logger.log(Level.INFO, "Document table " + tableName + " ready (" + dialect.name() + ")");
  }

  @Override
  protected <T> Committed<T> attempt(TransactionFunction<T> function) {
    BufferedTransaction tx = new BufferedTransaction() {
      @Override
      protected DocumentSnapshot read(DocumentRef ref) {
        return readOne(ref);
      }
    };
    T value = function.apply(tx);
    if (tx.writes().isEmpty()) {
      return new Committed<>(value, List.of());
    }
    return new Committed<>(value, commit(tx));
  }

  private List<DocumentChange> commit(BufferedTransaction tx) {
    Set<DocumentRef> ordered = new TreeSet<>(PATH_ORDER);
    ordered.addAll(tx.touched());

    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        List<DocumentChange> changes = commitLocked(conn, tx, ordered);
        conn.commit();
        return changes;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      if (dialect.isConflict(e)) {
        throw new TransactionConflictException("Concurrent write detected: " + e.getMessage());
      }
      throw new DocumentStoreException("Failed to commit transaction", e);
    }
  }

  private List<DocumentChange> commitLocked(Connection conn, BufferedTransaction tx, Set<DocumentRef> ordered)
      throws SQLException {
    Map<DocumentRef, DocumentSnapshot> current = new LinkedHashMap<>();
    for (DocumentRef ref : ordered) {
      DocumentSnapshot snapshot = JdbcTemplate.queryOne(conn, dialect.selectForUpdateSql(tableName),
          rowMapper, ref.collection(), ref.id()).orElseGet(() -> DocumentSnapshot.missing(ref));
      DocumentSnapshot seen = tx.reads().get(ref);
      if (seen != null && seen.version() != snapshot.version()) {
        throw new TransactionConflictException("Document changed during transaction: " + ref);
      }
      current.put(ref, snapshot);
    }

    Instant commitTime = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    List<DocumentChange> changes = new ArrayList<>();
    for (DocumentRef ref : tx.writes().refs()) {
      DocumentSnapshot before = current.get(ref);
      Map<String, Object> data = tx.writes().apply(ref, before.data());
      if (data == null && !before.exists()) {
        continue;
      }
      DocumentSnapshot after;
      int rows;
      if (data == null) {
        after = DocumentSnapshot.missing(ref);
        rows = JdbcTemplate.execute(conn, dialect.deleteSql(tableName),
            ref.collection(), ref.id(), before.version());
      } else {
        // after carries the decoded types a later read returns
        String json = codec.encode(data);
        long version = before.version() + 1;
        after = new DocumentSnapshot(ref, codec.decode(json), version, commitTime);
        rows = before.exists()
            ? JdbcTemplate.execute(conn, dialect.updateSql(tableName),
                json, version, commitTime, ref.collection(), ref.id(), before.version())
            : JdbcTemplate.execute(conn, dialect.insertSql(tableName),
                ref.collection(), ref.id(), json, version, commitTime, commitTime);
      }
      if (rows != 1) {
        throw new TransactionConflictException("Document changed during commit: " + ref);
      }
      changes.add(new DocumentChange(before, after));
    }
    return changes;
  }

  @Override
  public List<DocumentSnapshot> getAll(List<DocumentRef> refs, Set<String> fieldMask) {
    Objects.requireNonNull(refs, "refs");
    List<DocumentSnapshot> result = new ArrayList<>(refs.size());
    if (refs.isEmpty()) {
      return result;
    }
    try (Connection conn = connectionProvider.getConnection()) {
      for (DocumentRef ref : refs) {
        Optional<DocumentSnapshot> row = JdbcTemplate.queryOne(conn, dialect.selectSql(tableName),
            rowMapper, ref.collection(), ref.id());
        if (row.isEmpty()) {
          result.add(DocumentSnapshot.missing(ref));
          continue;
        }
        DocumentSnapshot snapshot = row.get();
        if (fieldMask != null) {
          snapshot = new DocumentSnapshot(ref, FieldPaths.project(snapshot.data(), fieldMask),
              snapshot.version(), snapshot.updateTime());
        }
        result.add(snapshot);
      }
    } catch (SQLException e) {
      throw new DocumentStoreException("Failed to read documents", e);
    }
    return result;
  }

  @Override
  public List<DocumentSnapshot> list(String collection) {
    Objects.requireNonNull(collection, "collection");
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryAll(conn, dialect.listSql(tableName), rowMapper, collection);
    } catch (SQLException e) {
      throw new DocumentStoreException("Failed to list collection " + collection, e);
    }
  }

  private DocumentSnapshot readOne(DocumentRef ref) {
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryOne(conn, dialect.selectSql(tableName), rowMapper, ref.collection(), ref.id())
          .orElseGet(() -> DocumentSnapshot.missing(ref));
    } catch (SQLException e) {
      throw new DocumentStoreException("Failed to read " + ref, e);
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  private static String loadSchema(String resource) {
    try (InputStream in = JdbcDocumentStore.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new DocumentStoreException("Schema resource not found: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DocumentStoreException("Failed to read schema resource " + resource, e);
    }
  }

  /**
   * Builder for {@link JdbcDocumentStore}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private Dialect dialect;
    private String tableName = TableNames.DEFAULT_TABLE;
    private JacksonDocumentCodec codec = new JacksonDocumentCodec();
    private Clock clock = Clock.systemUTC();
    private RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(20, 1000);
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    private Builder() {}

    /**
     * Source of connections for reads and commits.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Optional. Defaults to detection from the connection's JDBC URL.
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Optional. Defaults to {@value TableNames#DEFAULT_TABLE}.
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder codec(JacksonDocumentCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Source of commit timestamps. Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Delay between conflicting attempts. Optional. Defaults to exponential backoff
     * from 20ms up to 1s.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Total attempts per transaction. Optional. Defaults to {@value AbstractDocumentStore#DEFAULT_MAX_ATTEMPTS}.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public JdbcDocumentStore build() {
      return new JdbcDocumentStore(this);
    }
  }
}

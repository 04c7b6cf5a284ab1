package mailqueue.jdbc;

import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class PostgresDocumentStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("mailqueue_test");

  private static PGSimpleDataSource dataSource;
  private static JdbcDocumentStore store;

  @BeforeAll
  static void initSchema() {
    dataSource = new PGSimpleDataSource();
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUser(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
    store = JdbcDocumentStore.builder()
        .connectionProvider(ConnectionProvider.of(dataSource))
        .retryPolicy(attempt -> 5L)
        .maxAttempts(200)
        .build();
    store.createSchema();
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement statement = conn.createStatement()) {
      statement.execute("TRUNCATE TABLE " + store.tableName());
    }
  }

  @Test
  void dialectIsDetected() {
    assertEquals("postgresql", store.dialect().name());
  }

  @Test
  void documentRoundTrip() {
    DocumentRef ref = new DocumentRef("mail", "pg1");
    Instant lease = Instant.parse("2024-03-01T12:01:00Z");
    store.create(ref, Map.of("message", Map.of("to", List.of("a@x.com"))));
    store.update(ref, Map.of("delivery.state", "PROCESSING", "delivery.leaseExpireTime", lease));

    DocumentSnapshot snapshot = store.get(ref);
    assertEquals(2L, snapshot.version());
    assertEquals(List.of("a@x.com"), snapshot.get("message.to"));
    assertEquals(lease, snapshot.get("delivery.leaseExpireTime"));
  }

  @Test
  void concurrentClaimsHaveExactlyOneWinner() throws Exception {
    DocumentRef ref = new DocumentRef("mail", "contended");
    store.create(ref, Map.of("delivery", Map.of("state", "PENDING")));
    int threads = 6;
    AtomicInteger winners = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          boolean won = store.runTransaction(tx -> {
            if (!"PENDING".equals(tx.get(ref).get("delivery.state"))) {
              return false;
            }
            tx.update(ref, Map.of("delivery.state", "PROCESSING"));
            return true;
          });
          if (won) {
            winners.incrementAndGet();
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, winners.get());
    assertEquals("PROCESSING", store.get(ref).get("delivery.state"));
  }

  @Test
  void concurrentCreatesOfSameIdConflict() {
    DocumentRef ref = new DocumentRef("mail", "dup");
    AtomicInteger runs = new AtomicInteger();

    store.runTransaction(tx -> {
      boolean exists = tx.get(ref).exists();
      if (runs.incrementAndGet() == 1) {
        store.create(ref, Map.of("by", "other"));
      }
      if (!exists) {
        tx.create(ref, Map.of("by", "us"));
      }
      return null;
    });

    assertEquals(2, runs.get());
    assertEquals("other", store.get(ref).get("by"));
  }
}

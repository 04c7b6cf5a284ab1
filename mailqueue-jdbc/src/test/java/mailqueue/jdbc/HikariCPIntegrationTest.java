package mailqueue.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import mailqueue.MailQueue;
import mailqueue.MailQueueConfig;
import mailqueue.spi.DocumentRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private JdbcDocumentStore store;

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("mailqueue-test-pool");

    hikariDs = new HikariDataSource(config);
    store = JdbcDocumentStore.builder()
        .connectionProvider(ConnectionProvider.of(hikariDs))
        .build();
    store.createSchema();
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void pooledConnectionsAreReturnedAfterFailedCommits() {
    DocumentRef ref = new DocumentRef("mail", "m1");
    store.create(ref, Map.of("a", 1));

    for (int i = 0; i < 10; i++) {
      assertThrows(RuntimeException.class, () -> store.create(ref, Map.of("a", 2)));
    }

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void noConnectionLeaksAfterDeliveries() throws Exception {
    List<DocumentRef> refs = new ArrayList<>();
    try (MailQueue queue = MailQueue.builder()
        .documentStore(store)
        .config(new MailQueueConfig().setTesting(true).setTriggerWorkers(4))
        .build()) {
      for (int i = 0; i < 20; i++) {
        refs.add(queue.send(Map.of("to", "a" + i + "@x.com", "text", "t")));
      }
      for (DocumentRef ref : refs) {
        awaitSuccess(ref, 5_000);
      }
    }

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  private void awaitSuccess(DocumentRef ref, long timeoutMs) throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (System.currentTimeMillis() < deadline) {
      if ("SUCCESS".equals(store.get(ref).get("delivery.state"))) {
        return;
      }
      Thread.sleep(20);
    }
    fail("Document " + ref + " did not reach SUCCESS within " + timeoutMs + "ms");
  }
}

package mailqueue.template;

import mailqueue.MailQueue;
import mailqueue.MailQueueConfig;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.OutgoingMail;
import mailqueue.store.InMemoryDocumentStore;
import mailqueue.transport.InMemoryMailTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Templated messages delivered through a {@link MailQueue}.
 */
class TemplateMailQueueTest {
  private InMemoryDocumentStore store;
  private InMemoryMailTransport transport;
  private MailQueue queue;

  @BeforeEach
  void setUp() {
    store = new InMemoryDocumentStore();
    transport = new InMemoryMailTransport();
    queue = MailQueue.builder()
        .documentStore(store)
        .config(new MailQueueConfig()
            .setTemplatesCollection("templates")
            .setDefaultFrom("noreply@example.com"))
        .transport(transport)
        .templateRenderer(new DocumentTemplateRenderer(store, "templates"))
        .build();
  }

  @AfterEach
  void tearDown() {
    queue.close();
  }

  private DocumentSnapshot awaitState(DocumentRef ref, String state) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (System.currentTimeMillis() < deadline) {
      DocumentSnapshot snapshot = store.get(ref);
      if (state.equals(snapshot.get("delivery.state"))) {
        return snapshot;
      }
      Thread.sleep(20);
    }
    fail("Timed out waiting for " + ref + " to reach " + state + ", was " + store.get(ref).get("delivery.state"));
    return null;
  }

  @Test
  void templateIsRenderedIntoTheSentMessage() throws Exception {
    store.set(new DocumentRef("templates", "welcome"),
        Map.of("subject", "Welcome [[${name}]]", "html", "<p>Hi [[${name}]]</p>"));

    DocumentRef ref = queue.send(Map.of("to", "a@x.com",
        "template", Map.of("name", "welcome", "data", Map.of("name", "Ada"))));

    awaitState(ref, "SUCCESS");
    OutgoingMail mail = transport.sent().get(0);
    assertEquals("Welcome Ada", mail.subject());
    assertEquals("<p>Hi Ada</p>", mail.html());
  }

  @Test
  void templateEditsReachLaterMessages() throws Exception {
    DocumentRef template = new DocumentRef("templates", "notice");
    store.set(template, Map.of("subject", "first"));
    awaitState(queue.send(Map.of("to", "a@x.com", "template", Map.of("name", "notice"))), "SUCCESS");

    store.set(template, Map.of("subject", "second"));
    long deadline = System.currentTimeMillis() + 5000;
    String subject = null;
    while (System.currentTimeMillis() < deadline && !"second".equals(subject)) {
      transport.clear();
      awaitState(queue.send(Map.of("to", "a@x.com", "template", Map.of("name", "notice"))), "SUCCESS");
      subject = transport.sent().get(0).subject();
    }
    assertEquals("second", subject);
  }

  @Test
  void unknownTemplateRecordsAnError() throws Exception {
    DocumentRef ref = queue.send(Map.of("to", "a@x.com", "template", Map.of("name", "ghost")));

    DocumentSnapshot doc = awaitState(ref, "ERROR");

    assertEquals("Tried to render non-existent template 'ghost'", doc.get("delivery.error"));
    assertTrue(transport.sent().isEmpty());
  }
}

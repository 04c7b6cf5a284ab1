package mailqueue.smtp;

import com.icegreen.greenmail.junit5.GreenMailExtension;
import com.icegreen.greenmail.util.ServerSetupTest;
import jakarta.mail.internet.MimeMessage;
import mailqueue.MailQueue;
import mailqueue.MailQueueConfig;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.store.InMemoryDocumentStore;
import mailqueue.transport.MailTransports;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queue documents delivered over real SMTP to an embedded server.
 */
class SmtpMailQueueTest {

  @RegisterExtension
  static GreenMailExtension greenMail = new GreenMailExtension(ServerSetupTest.SMTP);

  private static DocumentSnapshot awaitTerminal(InMemoryDocumentStore store, DocumentRef ref) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    while (System.currentTimeMillis() < deadline) {
      DocumentSnapshot snapshot = store.get(ref);
      Object state = snapshot.get("delivery.state");
      if ("SUCCESS".equals(state) || "ERROR".equals(state)) {
        return snapshot;
      }
      Thread.sleep(20);
    }
    fail("Timed out waiting for " + ref);
    return null;
  }

  @Test
  void queuedMessageIsSentOverSmtp() throws Exception {
    String uri = "smtp://" + greenMail.getSmtp().getBindTo() + ":" + greenMail.getSmtp().getPort() + "?ignoreTLS=true";
    InMemoryDocumentStore store = new InMemoryDocumentStore();
    try (MailQueue queue = MailQueue.builder()
        .documentStore(store)
        .config(new MailQueueConfig().setDefaultFrom("noreply@example.com").setSmtpConnectionUri(uri))
        .transportFactory(() -> SmtpMailTransport.fromUri(uri))
        .build()) {
      DocumentRef ref = queue.send(Map.of(
          "to", List.of("one@example.com", "two@example.com"),
          "subject", "Welcome",
          "html", "<p>Welcome aboard</p>"));

      DocumentSnapshot doc = awaitTerminal(store, ref);

      assertEquals("SUCCESS", doc.get("delivery.state"), String.valueOf(doc.get("delivery.error")));
      assertEquals(List.of("one@example.com", "two@example.com"), doc.get("delivery.info.accepted"));
      assertNotNull(doc.get("delivery.info.messageId"));
      assertTrue(greenMail.waitForIncomingEmail(5_000, 2));
      MimeMessage received = greenMail.getReceivedMessages()[0];
      assertEquals("Welcome", received.getSubject());
      assertEquals("noreply@example.com", received.getFrom()[0].toString());
    }
  }

  @Test
  void invalidConnectionUriIsRecordedOnMessage() throws Exception {
    InMemoryDocumentStore store = new InMemoryDocumentStore();
    try (MailQueue queue = MailQueue.builder()
        .documentStore(store)
        .transportFactory(() -> SmtpMailTransport.fromUri("ftp://mail.local"))
        .build()) {
      DocumentRef ref = queue.send(Map.of("to", "a@example.com", "text", "t"));

      DocumentSnapshot doc = awaitTerminal(store, ref);

      assertEquals("ERROR", doc.get("delivery.state"));
      assertTrue(String.valueOf(doc.get("delivery.error")).startsWith("Invalid SMTP connection URI"));
    }
  }

  @Test
  void connectionUriAloneSelectsTheSmtpTransport() throws Exception {
    String uri = "smtp://" + greenMail.getSmtp().getBindTo() + ":" + greenMail.getSmtp().getPort() + "?ignoreTLS=true";
    InMemoryDocumentStore store = new InMemoryDocumentStore();
    try (MailQueue queue = MailQueue.builder()
        .documentStore(store)
        .config(new MailQueueConfig().setDefaultFrom("noreply@example.com").setSmtpConnectionUri(uri))
        .build()) {
      DocumentRef ref = queue.send(Map.of("to", "uri@example.com", "subject", "By URI", "text", "Hello"));

      DocumentSnapshot doc = awaitTerminal(store, ref);

      assertEquals("SUCCESS", doc.get("delivery.state"), String.valueOf(doc.get("delivery.error")));
      assertInstanceOf(SmtpMailTransport.class, queue.transport());
      assertTrue(greenMail.waitForIncomingEmail(5_000, 1));
      assertEquals("By URI", greenMail.getReceivedMessages()[0].getSubject());
    }
  }

  @Test
  void providerIsRegisteredForSmtpSchemes() {
    assertTrue(MailTransports.all().stream().anyMatch(p -> p instanceof SmtpMailTransportProvider));
    SmtpMailTransportProvider provider = new SmtpMailTransportProvider();
    assertTrue(provider.supports("SMTPS://bot@smtp.example.com"));
    assertFalse(provider.supports("http://smtp.example.com"));
    assertEquals("smtps", ((SmtpMailTransport) provider.create("smtps://smtp.example.com")).connection().protocol());
  }
}

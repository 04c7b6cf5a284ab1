package mailqueue.transport;

import mailqueue.spi.MailTransport;
import mailqueue.spi.OutgoingMail;
import mailqueue.spi.SendResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport for testing mode: accepts every recipient and keeps the messages in memory.
 * No network access.
 */
public final class InMemoryMailTransport implements MailTransport {
  private static final Logger logger = Logger.getLogger(InMemoryMailTransport.class.getName());

  private final List<OutgoingMail> sent = new CopyOnWriteArrayList<>();

  @Override
  public SendResult send(OutgoingMail mail) {
    sent.add(mail);
    String messageId = "<" + UUID.randomUUID() + "@mailqueue.test>";
    logger.log(Level.INFO, "Test transport accepted message " + messageId
        + " to " + mail.allRecipients() + " subject: " + mail.subject());
    return new SendResult(messageId, mail.allRecipients(), List.of(), List.of(), "250 Accepted (test mode)");
  }

  /**
   * Messages sent so far, in send order.
   */
  public List<OutgoingMail> sent() {
    return Collections.unmodifiableList(new ArrayList<>(sent));
  }

  public void clear() {
    sent.clear();
  }
}

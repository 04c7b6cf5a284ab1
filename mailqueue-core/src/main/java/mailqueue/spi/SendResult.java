package mailqueue.spi;

import java.util.List;

/**
 * Acceptance information returned by a {@link MailTransport}.
 *
 * @param messageId the Message-ID assigned to the sent message, may be {@code null}
 * @param accepted  recipients the server accepted
 * @param rejected  recipients the server refused
 * @param pending   recipients whose status is unknown (accepted addresses that were not sent to)
 * @param response  last server response line, may be {@code null}
 */
public record SendResult(
    String messageId,
    List<String> accepted,
    List<String> rejected,
    List<String> pending,
    String response
) {

  public SendResult {
    accepted = accepted == null ? List.of() : List.copyOf(accepted);
    rejected = rejected == null ? List.of() : List.copyOf(rejected);
    pending = pending == null ? List.of() : List.copyOf(pending);
  }
}

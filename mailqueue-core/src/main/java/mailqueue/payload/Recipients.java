package mailqueue.payload;

import java.util.List;

/**
 * Resolved recipient addresses of one message.
 *
 * @param to          primary recipients
 * @param cc          carbon-copy recipients
 * @param bcc         blind carbon-copy recipients
 * @param missingUids user ids that could not be resolved to an address
 */
public record Recipients(List<String> to, List<String> cc, List<String> bcc, List<String> missingUids) {

  public Recipients {
    to = List.copyOf(to);
    cc = List.copyOf(cc);
    bcc = List.copyOf(bcc);
    missingUids = missingUids == null ? List.of() : List.copyOf(missingUids);
  }

  public boolean isEmpty() {
    return to.isEmpty() && cc.isEmpty() && bcc.isEmpty();
  }
}

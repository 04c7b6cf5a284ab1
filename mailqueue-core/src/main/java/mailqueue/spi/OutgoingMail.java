package mailqueue.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fully resolved message handed to a {@link MailTransport}.
 *
 * <p>Recipients are concrete addresses; templates have already been expanded. Body fields the
 * queue does not interpret are carried in {@link #extras()} and passed through to the transport.
 *
 * @param from        sender address, may be {@code null} if neither message nor config set one
 * @param replyTo     reply-to address, may be {@code null}
 * @param to          primary recipients
 * @param cc          carbon-copy recipients
 * @param bcc         blind carbon-copy recipients
 * @param headers     additional message headers
 * @param subject     subject line, may be {@code null}
 * @param text        plain-text body, may be {@code null}
 * @param html        HTML body, may be {@code null}
 * @param amp         AMP4EMAIL body, may be {@code null}
 * @param attachments attachment descriptors ({@code filename}, {@code content}, {@code encoding},
 *                    {@code contentType}, {@code path})
 * @param extras      remaining message fields, passed through untouched
 */
public record OutgoingMail(
    String from,
    String replyTo,
    List<String> to,
    List<String> cc,
    List<String> bcc,
    Map<String, String> headers,
    String subject,
    String text,
    String html,
    String amp,
    List<Map<String, Object>> attachments,
    Map<String, Object> extras
) {

  public OutgoingMail {
    to = List.copyOf(Objects.requireNonNull(to, "to"));
    cc = List.copyOf(Objects.requireNonNull(cc, "cc"));
    bcc = List.copyOf(Objects.requireNonNull(bcc, "bcc"));
    headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    attachments = attachments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(attachments));
    extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  /**
   * All recipients in {@code to}, {@code cc}, {@code bcc} order.
   */
  public List<String> allRecipients() {
    List<String> all = new ArrayList<>(to.size() + cc.size() + bcc.size());
    all.addAll(to);
    all.addAll(cc);
    all.addAll(bcc);
    return all;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link OutgoingMail}. */
  public static final class Builder {
    private String from;
    private String replyTo;
    private List<String> to = List.of();
    private List<String> cc = List.of();
    private List<String> bcc = List.of();
    private Map<String, String> headers;
    private String subject;
    private String text;
    private String html;
    private String amp;
    private List<Map<String, Object>> attachments;
    private Map<String, Object> extras;

    private Builder() {}

    public Builder from(String from) {
      this.from = from;
      return this;
    }

    public Builder replyTo(String replyTo) {
      this.replyTo = replyTo;
      return this;
    }

    public Builder to(List<String> to) {
      this.to = to;
      return this;
    }

    public Builder to(String... to) {
      this.to = List.of(to);
      return this;
    }

    public Builder cc(List<String> cc) {
      this.cc = cc;
      return this;
    }

    public Builder bcc(List<String> bcc) {
      this.bcc = bcc;
      return this;
    }

    public Builder headers(Map<String, String> headers) {
      this.headers = headers;
      return this;
    }

    public Builder subject(String subject) {
      this.subject = subject;
      return this;
    }

    public Builder text(String text) {
      this.text = text;
      return this;
    }

    public Builder html(String html) {
      this.html = html;
      return this;
    }

    public Builder amp(String amp) {
      this.amp = amp;
      return this;
    }

    public Builder attachments(List<Map<String, Object>> attachments) {
      this.attachments = attachments;
      return this;
    }

    public Builder extras(Map<String, Object> extras) {
      this.extras = extras;
      return this;
    }

    public OutgoingMail build() {
      return new OutgoingMail(from, replyTo, to, cc, bcc, headers,
          subject, text, html, amp, attachments, extras);
    }
  }
}

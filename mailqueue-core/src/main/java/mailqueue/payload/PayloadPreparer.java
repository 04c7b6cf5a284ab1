package mailqueue.payload;

import mailqueue.DeliveryException;
import mailqueue.InvalidMessageException;
import mailqueue.model.MessageFields;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.OutgoingMail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link OutgoingMail} for one attempt: expands the template, resolves recipients,
 * applies the configured sender defaults, and rejects messages without any recipient.
 */
public final class PayloadPreparer {
  public static final String NO_RECIPIENTS = "Failed to deliver email. Expected at least 1 recipient.";

  private final TemplateExpander templateExpander;
  private final RecipientResolver recipientResolver;
  private final String defaultFrom;
  private final String defaultReplyTo;

  public PayloadPreparer(TemplateExpander templateExpander, RecipientResolver recipientResolver,
      String defaultFrom, String defaultReplyTo) {
    this.templateExpander = Objects.requireNonNull(templateExpander, "templateExpander");
    this.recipientResolver = Objects.requireNonNull(recipientResolver, "recipientResolver");
    this.defaultFrom = defaultFrom;
    this.defaultReplyTo = defaultReplyTo;
  }

  /**
   * @param ref     the message document
   * @param message the document's {@code message} map, {@code null} treated as empty
   * @throws DeliveryException if the message cannot be sent as given
   */
  public OutgoingMail prepare(DocumentRef ref, Map<String, Object> message) throws DeliveryException {
    Map<String, Object> fields = templateExpander.expand(ref, message == null ? Map.of() : message);
    Recipients recipients = recipientResolver.resolve(ref, fields);
    if (recipients.isEmpty()) {
      throw new InvalidMessageException(NO_RECIPIENTS);
    }

    String from = text(fields.get(MessageFields.FROM));
    String replyTo = text(fields.get(MessageFields.REPLY_TO));
    Map<String, Object> extras = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      if (!MessageFields.RESERVED.contains(entry.getKey()) && entry.getValue() != null) {
        extras.put(entry.getKey(), entry.getValue());
      }
    }

    return OutgoingMail.builder()
        .from(from != null ? from : defaultFrom)
        .replyTo(replyTo != null ? replyTo : defaultReplyTo)
        .to(recipients.to())
        .cc(recipients.cc())
        .bcc(recipients.bcc())
        .headers(headers(fields.get(MessageFields.HEADERS)))
        .subject(text(fields.get(MessageFields.SUBJECT)))
        .text(text(fields.get(MessageFields.TEXT)))
        .html(text(fields.get(MessageFields.HTML)))
        .amp(text(fields.get(MessageFields.AMP)))
        .attachments(attachments(fields.get(MessageFields.ATTACHMENTS)))
        .extras(extras)
        .build();
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }

  private static Map<String, String> headers(Object value) throws InvalidMessageException {
    if (value == null) {
      return Map.of();
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw new InvalidMessageException("Invalid field \"headers\". Expected a map of strings.");
    }
    Map<String, String> headers = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getValue() != null) {
        headers.put(String.valueOf(entry.getKey()), entry.getValue().toString());
      }
    }
    return headers;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> attachments(Object value) throws InvalidMessageException {
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new InvalidMessageException("Invalid field \"attachments\". Expected an array of objects.");
    }
    List<Map<String, Object>> attachments = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof Map)) {
        throw new InvalidMessageException("Invalid field \"attachments\". Expected an array of objects.");
      }
      attachments.add((Map<String, Object>) item);
    }
    return attachments;
  }
}

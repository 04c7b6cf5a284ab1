package mailqueue.model;

import java.util.Set;

/**
 * Field names inside a message document's {@code message} map.
 */
public final class MessageFields {
  public static final String MESSAGE = "message";

  public static final String TO = "to";
  public static final String CC = "cc";
  public static final String BCC = "bcc";
  public static final String TO_UIDS = "toUids";
  public static final String CC_UIDS = "ccUids";
  public static final String BCC_UIDS = "bccUids";
  public static final String FROM = "from";
  public static final String REPLY_TO = "replyTo";
  public static final String HEADERS = "headers";
  public static final String TEMPLATE = "template";

  public static final String SUBJECT = "subject";
  public static final String TEXT = "text";
  public static final String HTML = "html";
  public static final String AMP = "amp";
  public static final String ATTACHMENTS = "attachments";

  /** Fields the queue interprets itself; everything else is passed to the transport as is. */
  public static final Set<String> RESERVED = Set.of(
      TO, CC, BCC, TO_UIDS, CC_UIDS, BCC_UIDS, FROM, REPLY_TO, HEADERS, TEMPLATE,
      SUBJECT, TEXT, HTML, AMP, ATTACHMENTS);

  private MessageFields() {}
}

package mailqueue.smtp;

import jakarta.activation.DataHandler;
import jakarta.activation.DataSource;
import jakarta.activation.FileDataSource;
import jakarta.activation.URLDataSource;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import mailqueue.spi.OutgoingMail;
import mailqueue.spi.TransportException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link MimeMessage} from an {@link OutgoingMail}.
 *
 * <p>Bodies become {@code multipart/alternative} (text, AMP, HTML in that order) when more
 * than one is present; attachments wrap everything in {@code multipart/mixed}. An attachment
 * descriptor takes either inline {@code content} (plain, {@code base64} or {@code hex} per
 * {@code encoding}) or a {@code path}: a local file or an {@code http(s)} URL. A {@code cid}
 * makes it an inline part referable from the HTML body.
 */
final class MimeMessageComposer {
  static final String AMP_CONTENT_TYPE = "text/x-amp-html; charset=UTF-8";
  private static final String DEFAULT_ATTACHMENT_TYPE = "application/octet-stream";

  private final Session session;

  MimeMessageComposer(Session session) {
    this.session = session;
  }

  MimeMessage compose(OutgoingMail mail) throws TransportException {
    MimeMessage message = new MimeMessage(session);
    try {
      if (mail.from() != null) {
        message.setFrom(address(mail.from()));
      }
      if (mail.replyTo() != null) {
        message.setReplyTo(addresses(List.of(mail.replyTo())));
      }
      message.setRecipients(Message.RecipientType.TO, addresses(mail.to()));
      message.setRecipients(Message.RecipientType.CC, addresses(mail.cc()));
      message.setRecipients(Message.RecipientType.BCC, addresses(mail.bcc()));
      for (Map.Entry<String, String> header : mail.headers().entrySet()) {
        message.setHeader(header.getKey(), header.getValue());
      }
      if (mail.subject() != null) {
        message.setSubject(mail.subject(), StandardCharsets.UTF_8.name());
      }
      writeBody(message, mail);
      message.saveChanges();
    } catch (MessagingException e) {
      throw new TransportException("Failed to compose message: " + e.getMessage(), e);
    }
    return message;
  }

  private void writeBody(MimeMessage message, OutgoingMail mail) throws MessagingException, TransportException {
    List<MimeBodyPart> alternatives = new ArrayList<>();
    if (mail.text() != null) {
      alternatives.add(textPart(mail.text(), "plain"));
    }
    if (mail.amp() != null) {
      MimeBodyPart amp = new MimeBodyPart();
      amp.setDataHandler(new DataHandler(
          new ByteArrayDataSource(mail.amp().getBytes(StandardCharsets.UTF_8), AMP_CONTENT_TYPE)));
      alternatives.add(amp);
    }
    if (mail.html() != null) {
      alternatives.add(textPart(mail.html(), "html"));
    }

    if (mail.attachments().isEmpty()) {
      if (alternatives.isEmpty()) {
        message.setText("", StandardCharsets.UTF_8.name());
      } else if (alternatives.size() == 1 && mail.amp() == null) {
        boolean html = mail.html() != null;
        message.setText(html ? mail.html() : mail.text(), StandardCharsets.UTF_8.name(), html ? "html" : "plain");
      } else {
        message.setContent(alternative(alternatives));
      }
      return;
    }

    MimeMultipart mixed = new MimeMultipart("mixed");
    if (alternatives.size() == 1) {
      mixed.addBodyPart(alternatives.get(0));
    } else if (alternatives.size() > 1) {
      MimeBodyPart wrapper = new MimeBodyPart();
      wrapper.setContent(alternative(alternatives));
      mixed.addBodyPart(wrapper);
    }
    for (int i = 0; i < mail.attachments().size(); i++) {
      mixed.addBodyPart(attachmentPart(i, mail.attachments().get(i)));
    }
    message.setContent(mixed);
  }

  private static MimeBodyPart textPart(String body, String subtype) throws MessagingException {
    MimeBodyPart part = new MimeBodyPart();
    part.setText(body, StandardCharsets.UTF_8.name(), subtype);
    return part;
  }

  private static MimeMultipart alternative(List<MimeBodyPart> parts) throws MessagingException {
    MimeMultipart multipart = new MimeMultipart("alternative");
    for (MimeBodyPart part : parts) {
      multipart.addBodyPart(part);
    }
    return multipart;
  }

  private MimeBodyPart attachmentPart(int index, Map<String, Object> attachment)
      throws MessagingException, TransportException {
    String filename = stringField(attachment, "filename");
    String contentType = stringField(attachment, "contentType");
    Object content = attachment.get("content");
    String path = stringField(attachment, "path");

    DataSource source;
    if (content != null) {
      byte[] bytes = decodeContent(index, String.valueOf(content), stringField(attachment, "encoding"));
      source = new ByteArrayDataSource(bytes, contentType != null ? contentType : guessType(filename));
    } else if (path != null) {
      source = pathSource(index, path);
      if (filename == null) {
        filename = source.getName();
      }
    } else {
      throw new TransportException("Attachment " + index + " has neither content nor path");
    }

    MimeBodyPart part = new MimeBodyPart();
    part.setDataHandler(contentType != null && content == null
        ? new DataHandler(new TypedDataSource(source, contentType))
        : new DataHandler(source));
    if (filename != null) {
      part.setFileName(filename);
    }
    String cid = stringField(attachment, "cid");
    if (cid != null) {
      part.setContentID("<" + cid + ">");
      part.setDisposition(Part.INLINE);
    } else {
      part.setDisposition(Part.ATTACHMENT);
    }
    return part;
  }

  private static byte[] decodeContent(int index, String content, String encoding) throws TransportException {
    try {
      if (encoding == null || encoding.equalsIgnoreCase("utf8") || encoding.equalsIgnoreCase("utf-8")) {
        return content.getBytes(StandardCharsets.UTF_8);
      }
      if (encoding.equalsIgnoreCase("base64")) {
        return Base64.getMimeDecoder().decode(content);
      }
      if (encoding.equalsIgnoreCase("hex")) {
        return HexFormat.of().parseHex(content);
      }
    } catch (IllegalArgumentException e) {
      throw new TransportException("Attachment " + index + " content is not valid " + encoding, e);
    }
    throw new TransportException("Attachment " + index + " has unsupported encoding: " + encoding);
  }

  private static DataSource pathSource(int index, String path) throws TransportException {
    if (path.startsWith("http://") || path.startsWith("https://")) {
      try {
        return new URLDataSource(URI.create(path).toURL());
      } catch (MalformedURLException | IllegalArgumentException e) {
        throw new TransportException("Attachment " + index + " has an invalid URL", e);
      }
    }
    File file = new File(path);
    if (!file.isFile()) {
      throw new TransportException("Attachment " + index + " file not found: " + path);
    }
    return new FileDataSource(file);
  }

  private static String guessType(String filename) {
    String guessed = filename == null ? null : URLConnection.guessContentTypeFromName(filename);
    return guessed != null ? guessed : DEFAULT_ATTACHMENT_TYPE;
  }

  private static String stringField(Map<String, Object> attachment, String key) {
    Object value = attachment.get(key);
    return value == null ? null : String.valueOf(value);
  }

  private static InternetAddress address(String value) throws TransportException {
    try {
      return new InternetAddress(value, true);
    } catch (AddressException e) {
      throw new TransportException("Invalid address: " + value, e);
    }
  }

  private static InternetAddress[] addresses(List<String> values) throws TransportException {
    InternetAddress[] result = new InternetAddress[values.size()];
    for (int i = 0; i < values.size(); i++) {
      result[i] = address(values.get(i));
    }
    return result;
  }

  /**
   * Overrides the content type a file or URL source would report.
   */
  private record TypedDataSource(DataSource delegate, String contentType) implements DataSource {
    @Override
    public InputStream getInputStream() throws IOException {
      return delegate.getInputStream();
    }

    @Override
    public OutputStream getOutputStream() throws IOException {
      return delegate.getOutputStream();
    }

    @Override
    public String getContentType() {
      return contentType;
    }

    @Override
    public String getName() {
      return delegate.getName();
    }
  }
}

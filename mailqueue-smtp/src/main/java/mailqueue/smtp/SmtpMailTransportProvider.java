package mailqueue.smtp;

import mailqueue.spi.MailTransport;
import mailqueue.spi.MailTransportProvider;

import java.util.Locale;

/**
 * Registers {@link SmtpMailTransport} for {@code smtp:} and {@code smtps:} connection URIs.
 */
public final class SmtpMailTransportProvider implements MailTransportProvider {

  @Override
  public boolean supports(String uri) {
    String lower = uri.toLowerCase(Locale.ROOT);
    return lower.startsWith("smtp:") || lower.startsWith("smtps:");
  }

  @Override
  public MailTransport create(String uri) {
    return SmtpMailTransport.fromUri(uri);
  }
}

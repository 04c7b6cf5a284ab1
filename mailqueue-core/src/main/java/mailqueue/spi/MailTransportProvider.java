package mailqueue.spi;

/**
 * Creates a {@link MailTransport} from a connection URI.
 *
 * <p>Implementations are discovered through
 * {@code META-INF/services/mailqueue.spi.MailTransportProvider} and must have a public no-arg
 * constructor.
 *
 * @see mailqueue.transport.MailTransports
 */
public interface MailTransportProvider {

  /**
   * @param uri a connection URI, never null
   * @return whether {@link #create} handles this URI's scheme
   */
  boolean supports(String uri);

  /**
   * @throws IllegalArgumentException if the URI is malformed
   */
  MailTransport create(String uri);
}

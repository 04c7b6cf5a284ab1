/**
 * Service provider interfaces: the document store the queue runs on, and the collaborators a
 * delivery needs (mail transport, template renderer, user directory, metrics).
 *
 * <p>Implementations in this repository:
 * <ul>
 *   <li>{@link mailqueue.spi.DocumentStore} - {@link mailqueue.store.InMemoryDocumentStore},
 *       {@code mailqueue.jdbc.JdbcDocumentStore}</li>
 *   <li>{@link mailqueue.spi.MailTransport} - {@link mailqueue.transport.InMemoryMailTransport},
 *       {@code mailqueue.smtp.SmtpMailTransport}</li>
 *   <li>{@link mailqueue.spi.TemplateRenderer} - {@code mailqueue.template.DocumentTemplateRenderer}</li>
 *   <li>{@link mailqueue.spi.UserDirectory} - {@link mailqueue.directory.DocumentUserDirectory}</li>
 *   <li>{@link mailqueue.spi.MetricsExporter} - {@code mailqueue.micrometer.MicrometerMetricsExporter}</li>
 * </ul>
 */
package mailqueue.spi;

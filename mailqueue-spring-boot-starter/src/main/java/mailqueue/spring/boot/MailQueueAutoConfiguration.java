package mailqueue.spring.boot;

import mailqueue.MailQueue;
import mailqueue.MailQueueConfig;
import mailqueue.jdbc.ConnectionProvider;
import mailqueue.jdbc.JdbcDocumentStore;
import mailqueue.smtp.SmtpMailTransport;
import mailqueue.spi.DocumentStore;
import mailqueue.spi.MailTransport;
import mailqueue.spi.MetricsExporter;
import mailqueue.spi.TemplateRenderer;
import mailqueue.spi.UserDirectory;
import mailqueue.store.InMemoryDocumentStore;
import mailqueue.template.DocumentTemplateRenderer;
import mailqueue.trigger.ChangeListener;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Auto-configuration for the mail queue.
 *
 * <p>Wires a {@link MailQueue} from {@link MailQueueProperties}. Documents live in a
 * {@link JdbcDocumentStore} when a {@link DataSource} is present and in memory otherwise.
 * Messages go out through SMTP when {@code mailqueue.smtp-connection-uri} is set, or to an
 * in-memory transport when {@code mailqueue.testing} is true. Setting
 * {@code mailqueue.templates-collection} enables template rendering.
 *
 * <p>Every bean backs off when the application defines its own.
 *
 * @see MailQueueProperties
 * @see MailQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MailQueue.class)
@EnableConfigurationProperties(MailQueueProperties.class)
public class MailQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(DocumentStore.class)
  public DocumentStore mailDocumentStore(ObjectProvider<DataSource> dataSource, MailQueueProperties props) {
    DataSource available = dataSource.getIfUnique();
    if (available == null) {
      return new InMemoryDocumentStore();
    }
    JdbcDocumentStore store = JdbcDocumentStore.builder()
        .connectionProvider(ConnectionProvider.of(available))
        .tableName(props.getTableName())
        .build();
    if (props.isInitializeSchema()) {
      store.createSchema();
    }
    return store;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MailQueue mailQueue(MailQueueProperties props,
      DocumentStore documentStore,
      ObjectProvider<MailTransport> transportProvider,
      ObjectProvider<TemplateRenderer> rendererProvider,
      ObjectProvider<UserDirectory> userDirectoryProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ListableBeanFactory beanFactory) {

    MailQueue.Builder builder = MailQueue.builder()
        .documentStore(documentStore)
        .config(toConfig(props));
    MailTransport transport = transportProvider.getIfUnique();
    if (transport != null && !props.isTesting()) {
      builder.transport(transport);
    }
    TemplateRenderer renderer = rendererProvider.getIfUnique();
    if (renderer != null) {
      builder.templateRenderer(renderer);
    }
    UserDirectory userDirectory = userDirectoryProvider.getIfUnique();
    if (userDirectory != null) {
      builder.userDirectory(userDirectory);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    for (Map.Entry<String, ChangeListener> entry : MailQueueListeners.scan(beanFactory).entrySet()) {
      builder.changeListener(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  static MailQueueConfig toConfig(MailQueueProperties props) {
    return new MailQueueConfig()
        .setCollection(props.getCollection())
        .setUsersCollection(props.getUsersCollection())
        .setTemplatesCollection(props.getTemplatesCollection())
        .setDefaultFrom(props.getDefaultFrom())
        .setDefaultReplyTo(props.getDefaultReplyTo())
        .setSmtpConnectionUri(props.getSmtpConnectionUri())
        .setTesting(props.isTesting())
        .setLeaseDuration(props.getLeaseDuration())
        .setTriggerWorkers(props.getTrigger().getWorkerCount())
        .setTriggerQueueCapacity(props.getTrigger().getQueueCapacity())
        .setDrainTimeoutMs(props.getTrigger().getDrainTimeoutMs());
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(SmtpMailTransport.class)
  @ConditionalOnProperty(prefix = "mailqueue", name = "smtp-connection-uri")
  static class SmtpTransportConfiguration {

    @Bean
    @ConditionalOnMissingBean(MailTransport.class)
    public SmtpMailTransport mailTransport(MailQueueProperties props) {
      return SmtpMailTransport.fromUri(props.getSmtpConnectionUri());
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(DocumentTemplateRenderer.class)
  @ConditionalOnProperty(prefix = "mailqueue", name = "templates-collection")
  static class TemplateRendererConfiguration {

    @Bean
    @ConditionalOnMissingBean(TemplateRenderer.class)
    public DocumentTemplateRenderer templateRenderer(DocumentStore documentStore, MailQueueProperties props) {
      return new DocumentTemplateRenderer(documentStore, props.getTemplatesCollection());
    }
  }
}

package mailqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import mailqueue.micrometer.MicrometerMetricsExporter;
import mailqueue.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Map;

/**
 * Reports the queue's counters and gauges to the application's {@link MeterRegistry}.
 *
 * <p>Switched off with {@code mailqueue.metrics.enabled=false}. Meter names start with
 * {@code mailqueue.metrics.name-prefix}, and every entry of {@code mailqueue.metrics.tags}
 * becomes a tag on each meter.
 *
 * <p>Ordered before {@link MailQueueAutoConfiguration}, which hands the exporter to the queue.
 * Closing the queue removes the meters, so the exporter bean has no destroy method.
 */
@AutoConfiguration(before = MailQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "mailqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MailQueueProperties.class)
public class MailQueueMicrometerAutoConfiguration {

  @Bean(destroyMethod = "")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MailQueueProperties props) {
    MailQueueProperties.Metrics metrics = props.getMetrics();
    return new MicrometerMetricsExporter(meterRegistry, metrics.getNamePrefix(), commonTags(metrics.getTags()));
  }

  static Tags commonTags(Map<String, String> configured) {
    Tags tags = Tags.empty();
    for (Map.Entry<String, String> entry : configured.entrySet()) {
      tags = tags.and(entry.getKey(), entry.getValue());
    }
    return tags;
  }
}

package mailqueue.spring.boot;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import mailqueue.MailQueue;
import mailqueue.micrometer.MicrometerMetricsExporter;
import mailqueue.spi.MetricsExporter;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MailQueueMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          MailQueueMicrometerAutoConfiguration.class,
          MailQueueAutoConfiguration.class))
      .withUserConfiguration(RegistryConfig.class)
      .withPropertyValues("mailqueue.testing=true");

  @Test
  void deliveriesAreCountedInTheApplicationRegistry() {
    runner.run(ctx -> {
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);

      ctx.getBean(MailQueue.class).send(Map.of("to", "a@x.com", "subject", "s", "text", "t"));

      awaitCount(registry, "mailqueue.delivery.success", 1);
      assertEquals(1.0, registry.get("mailqueue.delivery.initialized").counter().count());
      assertEquals(0.0, registry.get("mailqueue.delivery.error").counter().count());
      assertEquals(1.0, registry.get("mailqueue.delivery.claimed").counter().count());
    });
  }

  @Test
  void namePrefixIsConfigurable() {
    runner.withPropertyValues("mailqueue.metrics.name-prefix=billing.mail").run(ctx -> {
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("billing.mail.delivery.claimed").counter());
      assertNull(registry.find("mailqueue.delivery.claimed").counter());
    });
  }

  @Test
  void configuredTagsAreAddedToEveryMeter() {
    runner.withPropertyValues("mailqueue.metrics.tags.app=billing", "mailqueue.metrics.tags.region=eu")
        .run(ctx -> {
          MeterRegistry registry = ctx.getBean(MeterRegistry.class);
          assertNotNull(registry.find("mailqueue.delivery.success").tags("app", "billing", "region", "eu").counter());
          assertNotNull(registry.find("mailqueue.trigger.queue.depth").tag("app", "billing").gauge());
          assertEquals(Map.of("app", "billing", "region", "eu"),
              ctx.getBean(MailQueueProperties.class).getMetrics().getTags());
        });
  }

  @Test
  void withoutMeterRegistryNoExporterIsCreated() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            MailQueueMicrometerAutoConfiguration.class,
            MailQueueAutoConfiguration.class))
        .withPropertyValues("mailqueue.testing=true")
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertFalse(ctx.containsBean("micrometerMetricsExporter"));
          assertTrue(ctx.containsBean("mailQueue"));
        });
  }

  @Test
  void invalidNamePrefixFailsStartup() {
    runner.withPropertyValues("mailqueue.metrics.name-prefix=billing.mail.").run(ctx ->
        assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void metricsCanBeSwitchedOff() {
    runner.withPropertyValues("mailqueue.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
      assertTrue(ctx.getBean(MeterRegistry.class).getMeters().isEmpty());
      assertTrue(ctx.containsBean("mailQueue"));
    });
  }

  @Test
  void applicationExporterWins() {
    runner.withUserConfiguration(NoopExporterConfig.class).run(ctx -> {
      assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
      assertTrue(ctx.getBean(MeterRegistry.class).getMeters().isEmpty());
    });
  }

  @Test
  void closingTheContextRemovesTheMeters() {
    runner.run(ctx -> {
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("mailqueue.trigger.queue.depth").gauge());

      ctx.close();

      assertNull(registry.find("mailqueue.trigger.queue.depth").gauge());
      assertNull(registry.find("mailqueue.delivery.success").counter());
    });
  }

  private static void awaitCount(MeterRegistry registry, String name, double expected)
      throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (System.currentTimeMillis() < deadline) {
      Counter counter = registry.find(name).counter();
      if (counter != null && counter.count() >= expected) {
        return;
      }
      Thread.sleep(20);
    }
    fail("Timed out waiting for " + name + " to reach " + expected);
  }

  @Configuration
  static class RegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class NoopExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return MetricsExporter.NOOP;
    }
  }
}

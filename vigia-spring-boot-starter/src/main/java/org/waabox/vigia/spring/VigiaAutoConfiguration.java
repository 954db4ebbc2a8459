package org.waabox.vigia.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.vigia.Vigia;
import org.waabox.vigia.channel.ChangeChannel;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.poll.ResourceQuery;
import org.waabox.vigia.poll.SchemaIntrospection;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * Spring Boot auto-configuration for the Vigia change-notification client.
 *
 * <p>Active when the application context holds a {@link ChangeChannel}
 * bean. Creates a singleton {@link Vigia} instance configured from
 * {@link VigiaProperties}, wiring the optional {@link ResourceQuery},
 * {@link SchemaIntrospection}, {@link VigiaMetrics} and
 * {@link TaskScheduler} beans when present. Without a
 * {@link ResourceQuery} subscriptions cannot fall back to polling.
 *
 * <p>All {@link SubscriptionRegistrar} beans are invoked when the
 * {@link SmartLifecycle} starts. Stopping the lifecycle releases every
 * subscription; the Vigia bean is shut down when the context closes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@ConditionalOnBean(ChangeChannel.class)
@EnableConfigurationProperties(VigiaProperties.class)
public class VigiaAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      VigiaAutoConfiguration.class);

  /**
   * Creates the singleton {@link Vigia} bean.
   *
   * @param properties               the configuration properties, never null
   * @param changeChannel            the live change channel, never null
   * @param resourceQueryProvider    provider for an optional ResourceQuery
   * @param introspectionProvider    provider for an optional
   *                                 SchemaIntrospection
   * @param metricsProvider          provider for an optional VigiaMetrics
   * @param schedulerProvider        provider for an optional TaskScheduler
   *
   * @return the configured Vigia instance, never null
   */
  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public Vigia vigia(
      final VigiaProperties properties,
      final ChangeChannel changeChannel,
      final ObjectProvider<ResourceQuery> resourceQueryProvider,
      final ObjectProvider<SchemaIntrospection> introspectionProvider,
      final ObjectProvider<VigiaMetrics> metricsProvider,
      final ObjectProvider<TaskScheduler> schedulerProvider) {

    requireAtMostOne(resourceQueryProvider, ResourceQuery.class);
    requireAtMostOne(introspectionProvider, SchemaIntrospection.class);

    final Vigia.Builder builder = Vigia.builder()
        .changeChannel(changeChannel)
        .config(properties.toConfig());

    log.info("Vigia using ChangeChannel: {}",
        changeChannel.getClass().getSimpleName());

    resourceQueryProvider.ifAvailable(query -> {
      builder.resourceQuery(query);
      log.info("Vigia using ResourceQuery: {}",
          query.getClass().getSimpleName());
    });

    introspectionProvider.ifAvailable(introspection -> {
      builder.schemaIntrospection(introspection);
      log.info("Vigia using SchemaIntrospection: {}",
          introspection.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Vigia using custom VigiaMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    schedulerProvider.ifAvailable(scheduler -> {
      builder.scheduler(scheduler);
      log.info("Vigia using custom TaskScheduler: {}",
          scheduler.getClass().getSimpleName());
    });

    if (resourceQueryProvider.getIfAvailable() == null) {
      log.warn("No ResourceQuery bean found, subscriptions will not fall "
          + "back to polling");
    }

    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that invokes the subscription
   * registrars on start and releases every subscription on stop.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1}) so
   * listeners can rely on fully initialized beans, and stops early for the
   * same reason.
   *
   * @param vigia      the Vigia instance to manage, never null
   * @param registrars the subscription registrars, may be empty
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle vigiaLifecycle(final Vigia vigia,
      final List<SubscriptionRegistrar> registrars) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Vigia lifecycle with {} registrar(s)...",
            registrars.size());
        for (final SubscriptionRegistrar registrar : registrars) {
          registrar.register(vigia);
          log.debug("Invoked SubscriptionRegistrar: {}",
              registrar.getClass().getSimpleName());
        }
        running = true;
        log.info("Vigia lifecycle started with {} subscription(s).",
            vigia.subscriptions().size());
      }

      @Override
      public void stop() {
        log.info("Stopping Vigia lifecycle...");
        vigia.cleanupAll();
        running = false;
        log.info("Vigia lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Validates that at most one bean of the given type is present.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Vigia requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}

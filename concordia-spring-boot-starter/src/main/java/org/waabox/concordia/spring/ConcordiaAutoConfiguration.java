package org.waabox.concordia.spring;

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
import org.waabox.concordia.Concordia;
import org.waabox.concordia.event.EventSyncSettings;
import org.waabox.concordia.event.FieldOverrides;
import org.waabox.concordia.event.LocationType;
import org.waabox.concordia.member.SpaceMapping;
import org.waabox.concordia.metrics.ConcordiaMetrics;
import org.waabox.concordia.source.SourceDirectory;
import org.waabox.concordia.state.StateStore;
import org.waabox.concordia.target.TargetRegistry;

/**
 * Spring Boot auto-configuration for Concordia.
 *
 * <p>Creates a singleton {@link Concordia} once the application context
 * holds a {@link SourceDirectory} and a {@link TargetRegistry}. A
 * {@link StateStore} and a {@link ConcordiaMetrics} bean are wired when
 * present; otherwise the state lives in memory and metrics are dropped.
 * The space mapping and event settings come from
 * {@link ConcordiaProperties}.
 *
 * <p>Start and stop are driven through a {@link SmartLifecycle}: state is
 * loaded once every other bean is ready, and saved on shutdown.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ConcordiaProperties.class)
public class ConcordiaAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConcordiaAutoConfiguration.class);

  /**
   * Creates the singleton {@link Concordia} bean.
   *
   * @param properties            the configuration properties, never null
   * @param sourceDirectory       the directory to read from, never null
   * @param targetRegistry        the registry to write to, never null
   * @param stateStoreProvider    provider for an optional StateStore bean
   * @param metricsProvider       provider for an optional
   *                              ConcordiaMetrics bean
   *
   * @return the configured Concordia instance, never null
   */
  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({SourceDirectory.class, TargetRegistry.class})
  public Concordia concordia(
      final ConcordiaProperties properties,
      final SourceDirectory sourceDirectory,
      final TargetRegistry targetRegistry,
      final ObjectProvider<StateStore> stateStoreProvider,
      final ObjectProvider<ConcordiaMetrics> metricsProvider) {

    requireAtMostOne(stateStoreProvider, StateStore.class);

    final Concordia.Builder builder = Concordia.builder()
        .sourceDirectory(sourceDirectory)
        .targetRegistry(targetRegistry)
        .spaceMapping(spaceMapping(properties.getMapping()))
        .eventSyncSettings(eventSyncSettings(properties.getEvents()));

    stateStoreProvider.ifAvailable(store -> {
      builder.stateStore(store);
      log.info("Concordia using StateStore: {}",
          store.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Concordia using custom ConcordiaMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    log.info("Concordia created with {} default space(s), {} mapped plan(s)"
        + " and event space {}",
        properties.getMapping().getDefaultSpaces().size(),
        properties.getMapping().getPlansToSpaces().size(),
        properties.getEvents().getDefaultSpaceId());

    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops
   * Concordia.
   *
   * <p>Runs in phase {@code Integer.MAX_VALUE - 1}: it starts after, and
   * stops before, the other lifecycle beans.
   *
   * @param concordia the Concordia instance to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  @ConditionalOnBean(Concordia.class)
  public SmartLifecycle concordiaLifecycle(final Concordia concordia) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Concordia lifecycle...");
        concordia.start();
        running = true;
      }

      @Override
      public void stop() {
        log.info("Stopping Concordia lifecycle...");
        concordia.stop();
        running = false;
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

  static SpaceMapping spaceMapping(final ConcordiaProperties.Mapping mapping) {
    return new SpaceMapping(mapping.getDefaultSpaces(),
        mapping.getPlansToSpaces());
  }

  static EventSyncSettings eventSyncSettings(
      final ConcordiaProperties.Events events) {
    final ConcordiaProperties.FieldOverrides overrides =
        events.getFieldOverrides();
    final String locationType = overrides.getLocationType();
    return EventSyncSettings.builder()
        .defaultSpaceId(events.getDefaultSpaceId())
        .createNew(events.isCreateNew())
        .updateExisting(events.isUpdateExisting())
        .deleteRemoved(events.isDeleteRemoved())
        .publishedOnly(events.isPublishedOnly())
        .futureOnly(events.isFutureOnly())
        .fieldOverrides(new FieldOverrides(
            overrides.getHost(),
            locationType == null || locationType.isBlank()
                ? null : LocationType.fromWireName(locationType),
            overrides.getRsvpDisabled(),
            overrides.getSendEmailConfirmation(),
            overrides.getSendEmailReminder()))
        .build();
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Concordia requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}

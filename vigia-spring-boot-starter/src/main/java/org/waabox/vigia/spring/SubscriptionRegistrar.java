package org.waabox.vigia.spring;

import org.waabox.vigia.Vigia;

/**
 * A callback interface for subscribing to resources with the
 * auto-configured {@link Vigia} instance.
 *
 * <p>Implement this interface as a Spring bean to declare the
 * subscriptions of the application. All discovered
 * {@code SubscriptionRegistrar} beans are invoked when the application
 * context starts, after every other bean has been initialized.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * SubscriptionRegistrar widgetsRegistrar(WidgetCache cache) {
 *     return vigia -> vigia.subscribe("widgets", EventFilter.ANY,
 *         cache::apply);
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SubscriptionRegistrar {

  /**
   * Registers one or more subscriptions with the given Vigia instance.
   *
   * @param vigia the Vigia instance to subscribe with, never null
   */
  void register(Vigia vigia);
}

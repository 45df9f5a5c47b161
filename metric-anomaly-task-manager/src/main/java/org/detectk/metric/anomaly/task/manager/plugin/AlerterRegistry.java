package org.detectk.metric.anomaly.task.manager.plugin;

import com.typesafe.config.Config;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.detectk.metric.anomaly.datamodel.Alerter;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;
import org.detectk.notification.transport.webhook.WebhookAlerter;
import org.detectk.notification.transport.webhook.WebhookAlerterConfig;

/** Alerter types available to configured checks; {@code webhook} is built in. */
public class AlerterRegistry {
  public static final String ALERTER_TYPE_WEBHOOK = "webhook";

  private final Map<String, AlerterFactory> factories = new ConcurrentHashMap<>();

  public static AlerterRegistry withBuiltInAlerters() {
    return new AlerterRegistry()
        .register(
            ALERTER_TYPE_WEBHOOK, params -> new WebhookAlerter(WebhookAlerterConfig.from(params)));
  }

  public AlerterRegistry register(String type, AlerterFactory factory) {
    if (factories.putIfAbsent(type, factory) != null) {
      throw new ConfigurationException(
          String.format("Alerter type:%s is already registered", type));
    }
    return this;
  }

  public Alerter create(Config alerterConfig) {
    String type = CollectorRegistry.typeOf(alerterConfig, "Alerter");
    AlerterFactory factory = factories.get(type);
    if (factory == null) {
      throw new ConfigurationException(String.format("Invalid alerter type:%s", type));
    }
    return factory.create(CollectorRegistry.paramsOf(alerterConfig));
  }
}

package org.detectk.metric.anomaly.task.manager.plugin;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.detectk.metric.anomaly.datamodel.Collector;
import org.detectk.metric.anomaly.datamodel.SeasonalFeatures;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

/**
 * Collector types available to configured checks. Data-source drivers register themselves here
 * before the service is initialized; a check then refers to one by name:
 *
 * <pre>
 * collector { type = orders-db, params { table = orders } }
 * </pre>
 *
 * <p>With {@code calendarZone} set, every collected point also carries the calendar features of
 * its timestamp in that zone; context supplied by the collector itself wins.
 */
public class CollectorRegistry {
  static final String TYPE = "type";
  static final String PARAMS = "params";
  static final String CALENDAR_ZONE = "calendarZone";

  private final Map<String, CollectorFactory> factories = new ConcurrentHashMap<>();

  public CollectorRegistry register(String type, CollectorFactory factory) {
    if (factories.putIfAbsent(type, factory) != null) {
      throw new ConfigurationException(
          String.format("Collector type:%s is already registered", type));
    }
    return this;
  }

  public Collector create(Config collectorConfig) {
    String type = typeOf(collectorConfig, "Collector");
    CollectorFactory factory = factories.get(type);
    if (factory == null) {
      throw new ConfigurationException(String.format("Invalid collector type:%s", type));
    }
    Collector collector = factory.create(paramsOf(collectorConfig));
    if (!collectorConfig.hasPath(CALENDAR_ZONE)) {
      return collector;
    }
    return withCalendarContext(collector, zoneOf(collectorConfig.getString(CALENDAR_ZONE)));
  }

  static Collector withCalendarContext(Collector collector, ZoneId zone) {
    return (periodStart, periodEnd) ->
        collector.collect(periodStart, periodEnd).stream()
            .map(measurement -> SeasonalFeatures.withCalendarContext(measurement, zone))
            .collect(Collectors.toList());
  }

  private static ZoneId zoneOf(String zone) {
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException e) {
      throw new ConfigurationException(String.format("Invalid %s:%s", CALENDAR_ZONE, zone), e);
    }
  }

  static String typeOf(Config pluginConfig, String pluginKind) {
    if (!pluginConfig.hasPath(TYPE)) {
      throw new ConfigurationException(pluginKind + " configuration requires a " + TYPE);
    }
    return pluginConfig.getString(TYPE);
  }

  static Config paramsOf(Config pluginConfig) {
    return pluginConfig.hasPath(PARAMS)
        ? pluginConfig.getConfig(PARAMS)
        : ConfigFactory.parseMap(Map.of());
  }
}

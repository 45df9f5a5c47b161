package org.detectk.metric.anomaly.datamodel;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/** Calendar features collectors attach to measurements as seasonal context. */
public class SeasonalFeatures {
  public static final String HOUR_OF_DAY = "hour_of_day";
  public static final String DAY_OF_WEEK = "day_of_week";
  public static final String DAY_OF_MONTH = "day_of_month";
  public static final String MONTH = "month";
  public static final String IS_WEEKEND = "is_weekend";

  public static final Set<String> ALL =
      Set.of(HOUR_OF_DAY, DAY_OF_WEEK, DAY_OF_MONTH, MONTH, IS_WEEKEND);

  private SeasonalFeatures() {}

  /**
   * Computes all calendar features for a timestamp. {@code day_of_week} is 0 for Monday through 6
   * for Sunday.
   */
  public static Map<String, Object> of(Instant timestamp, ZoneId zone) {
    ZonedDateTime dateTime = timestamp.atZone(zone);
    DayOfWeek dayOfWeek = dateTime.getDayOfWeek();
    Map<String, Object> features = new HashMap<>();
    features.put(HOUR_OF_DAY, dateTime.getHour());
    features.put(DAY_OF_WEEK, dayOfWeek.getValue() - 1);
    features.put(DAY_OF_MONTH, dateTime.getDayOfMonth());
    features.put(MONTH, dateTime.getMonthValue());
    features.put(IS_WEEKEND, dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY);
    return Map.copyOf(features);
  }

  /** Same as {@link #of(Instant, ZoneId)} restricted to the requested feature names. */
  public static Map<String, Object> of(Instant timestamp, ZoneId zone, Set<String> features) {
    Map<String, Object> all = of(timestamp, zone);
    Map<String, Object> selected = new HashMap<>();
    for (String feature : features) {
      if (!all.containsKey(feature)) {
        throw new IllegalArgumentException("Unknown seasonal feature: " + feature);
      }
      selected.put(feature, all.get(feature));
    }
    return Map.copyOf(selected);
  }

  public static Measurement withCalendarContext(Measurement measurement, ZoneId zone) {
    Map<String, Object> context = new HashMap<>(of(measurement.getTimestamp(), zone));
    context.putAll(measurement.getContext());
    return measurement.toBuilder().context(Map.copyOf(context)).build();
  }
}

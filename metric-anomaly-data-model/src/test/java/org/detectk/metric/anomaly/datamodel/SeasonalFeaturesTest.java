package org.detectk.metric.anomaly.datamodel;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SeasonalFeaturesTest {

  @Test
  void testCalendarFeatures() {
    // Saturday
    Map<String, Object> features =
        SeasonalFeatures.of(Instant.parse("2024-03-16T14:30:00Z"), ZoneOffset.UTC);
    Assertions.assertEquals(14, features.get(SeasonalFeatures.HOUR_OF_DAY));
    Assertions.assertEquals(5, features.get(SeasonalFeatures.DAY_OF_WEEK));
    Assertions.assertEquals(16, features.get(SeasonalFeatures.DAY_OF_MONTH));
    Assertions.assertEquals(3, features.get(SeasonalFeatures.MONTH));
    Assertions.assertEquals(true, features.get(SeasonalFeatures.IS_WEEKEND));
  }

  @Test
  void testZoneShiftsHour() {
    Map<String, Object> features =
        SeasonalFeatures.of(
            Instant.parse("2024-03-16T14:30:00Z"),
            ZoneId.of("Asia/Tokyo"),
            Set.of(SeasonalFeatures.HOUR_OF_DAY));
    Assertions.assertEquals(Map.of(SeasonalFeatures.HOUR_OF_DAY, 23), features);
  }

  @Test
  void testUnknownFeature() {
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> SeasonalFeatures.of(Instant.EPOCH, ZoneOffset.UTC, Set.of("minute_of_hour")));
  }

  @Test
  void testCollectorContextWins() {
    Measurement measurement =
        Measurement.of(
            Instant.parse("2024-03-16T14:30:00Z"), 1.0, Map.of(SeasonalFeatures.HOUR_OF_DAY, 3));
    Measurement enriched = SeasonalFeatures.withCalendarContext(measurement, ZoneOffset.UTC);
    Assertions.assertEquals(3, enriched.getContext().get(SeasonalFeatures.HOUR_OF_DAY));
    Assertions.assertEquals(5, enriched.getContext().get(SeasonalFeatures.DAY_OF_WEEK));
  }
}

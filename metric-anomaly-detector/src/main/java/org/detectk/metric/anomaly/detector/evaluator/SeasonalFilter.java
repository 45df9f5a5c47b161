package org.detectk.metric.anomaly.detector.evaluator;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.exception.DetectionException;

/**
 * Selects the history points comparable to the current one. Combined mode requires a match on
 * every feature, separate mode on at least one, so combined groups are always contained in the
 * separate group for the same target.
 */
public class SeasonalFilter {
  private final List<String> features;
  private final boolean combined;

  public SeasonalFilter(List<String> features, boolean combined) {
    this.features = List.copyOf(features);
    this.combined = combined;
  }

  public boolean isActive() {
    return !features.isEmpty();
  }

  public Predicate<Map<String, Object>> forTarget(Measurement current) throws DetectionException {
    if (!isActive()) {
      return context -> true;
    }
    Map<String, Object> target = new HashMap<>();
    for (String feature : features) {
      Object value = current.getContext().get(feature);
      if (value == null) {
        throw new DetectionException(
            String.format(
                "Seasonal feature %s missing from context of point at %s",
                feature, current.getTimestamp()));
      }
      target.put(feature, value);
    }
    if (combined) {
      return context -> features.stream().allMatch(f -> sameValue(target.get(f), context.get(f)));
    }
    return context -> features.stream().anyMatch(f -> sameValue(target.get(f), context.get(f)));
  }

  static boolean sameValue(Object expected, Object actual) {
    if (expected instanceof Number && actual instanceof Number) {
      try {
        return new BigDecimal(expected.toString()).compareTo(new BigDecimal(actual.toString()))
            == 0;
      } catch (NumberFormatException e) {
        // NaN or infinite
        return expected.equals(actual);
      }
    }
    return Objects.equals(expected, actual);
  }

  @Override
  public String toString() {
    return (combined ? "combined" : "separate") + features;
  }
}

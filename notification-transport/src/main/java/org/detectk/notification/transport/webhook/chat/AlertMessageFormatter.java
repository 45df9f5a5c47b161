package org.detectk.notification.transport.webhook.chat;

import com.google.common.base.Strings;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Direction;

/** Renders a detection result as a markdown chat message. */
public class AlertMessageFormatter {
  static final String TITLE = ":rotating_light: **ANOMALY DETECTED** `%s`";
  static final String EXTREME_SCORE = "∞ (extreme outlier)";
  private static final String DETECTOR_TYPE = "detector_type";
  private static final String WINDOW_SIZE = "window_size";
  private static final String N_SIGMA = "n_sigma";
  private static final String OPERATOR = "operator";

  private final DateTimeFormatter timestampFormatter;

  public AlertMessageFormatter() {
    this(ZoneOffset.UTC);
  }

  public AlertMessageFormatter(ZoneId zone) {
    this.timestampFormatter =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z", Locale.ROOT).withZone(zone);
  }

  public String format(DetectionResult result) {
    List<String> lines = new ArrayList<>();
    lines.add(String.format(TITLE, result.getMetricName()));
    lines.add("");
    lines.add(
        String.format(
            "**Value:** %s%s", formatNumber(result.getValue()), formatDirection(result)));
    if (result.getLowerBound() != null && result.getUpperBound() != null) {
      lines.add(
          String.format(
              "**Expected:** [%s - %s]",
              formatNumber(result.getLowerBound()), formatNumber(result.getUpperBound())));
    }
    if (result.getScore() != null) {
      lines.add(String.format("**Score:** %s", formatScore(result.getScore())));
    }
    if (result.getPercentDeviation() != null) {
      lines.add(
          String.format(Locale.ROOT, "**Deviation:** %+.1f%%", result.getPercentDeviation()));
    }
    lines.add("");
    lines.add(timestampFormatter.format(result.getTimestamp()));
    lines.add(formatDetector(result));
    return String.join("\n", lines);
  }

  static String formatScore(double score) {
    if (Double.isInfinite(score)) {
      return EXTREME_SCORE;
    }
    return String.format(Locale.ROOT, "%.2f sigma", score);
  }

  private static String formatNumber(Double value) {
    if (value == null) {
      return "n/a";
    }
    return String.format(Locale.ROOT, "%,.2f", value);
  }

  private static String formatDirection(DetectionResult result) {
    Direction direction = result.getDirection();
    if (direction == null) {
      return "";
    }
    return direction == Direction.UP ? " (up)" : " (down)";
  }

  private static String formatDetector(DetectionResult result) {
    Map<String, Object> metadata = result.getMetadata();
    String type = String.valueOf(metadata.getOrDefault(DETECTOR_TYPE, "unknown"));
    List<String> details = new ArrayList<>();
    addIfPresent(details, metadata, WINDOW_SIZE, "window");
    addIfPresent(details, metadata, N_SIGMA, "n_sigma");
    addIfPresent(details, metadata, OPERATOR, "operator");
    String suffix = details.isEmpty() ? "" : " (" + String.join(", ", details) + ")";
    return String.format("Detector: %s [%s]%s", type, result.getDetectorId(), suffix);
  }

  private static void addIfPresent(
      List<String> details, Map<String, Object> metadata, String key, String label) {
    Object value = metadata.get(key);
    if (value != null && !Strings.isNullOrEmpty(value.toString())) {
      details.add(label + ": " + value);
    }
  }
}

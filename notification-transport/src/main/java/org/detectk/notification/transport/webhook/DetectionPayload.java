package org.detectk.notification.transport.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import org.detectk.metric.anomaly.datamodel.DetectionResult;

/** JSON body posted for {@link WebhookFormat#JSON} webhooks. */
@Getter
@Builder
public class DetectionPayload {
  @JsonProperty("metric_name")
  private final String metricName;

  @JsonProperty("detector_id")
  private final String detectorId;

  private final String timestamp;
  private final Double value;

  @JsonProperty("is_anomaly")
  private final boolean anomaly;

  private final Double score;

  @JsonProperty("lower_bound")
  private final Double lowerBound;

  @JsonProperty("upper_bound")
  private final Double upperBound;

  private final String direction;

  @JsonProperty("percent_deviation")
  private final Double percentDeviation;

  private final Map<String, Object> metadata;

  public static DetectionPayload from(DetectionResult result) {
    return DetectionPayload.builder()
        .metricName(result.getMetricName())
        .detectorId(result.getDetectorId())
        .timestamp(result.getTimestamp().toString())
        .value(result.getValue())
        .anomaly(result.isAnomaly())
        .score(finiteOrNull(result.getScore()))
        .lowerBound(result.getLowerBound())
        .upperBound(result.getUpperBound())
        .direction(result.getDirection() == null ? null : result.getDirection().getLabel())
        .percentDeviation(result.getPercentDeviation())
        .metadata(result.getMetadata())
        .build();
  }

  // JSON has no literal for infinity
  private static Double finiteOrNull(Double value) {
    return value == null || value.isInfinite() || value.isNaN() ? null : value;
  }
}

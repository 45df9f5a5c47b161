package org.detectk.metric.anomaly.datamodel;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import lombok.Value;

@Value
public class RetentionPolicy {
  public static final int DEFAULT_RETENTION_DAYS = 90;

  int measurementsDays;
  int detectionsDays;

  public RetentionPolicy(int measurementsDays, int detectionsDays) {
    Preconditions.checkArgument(
        measurementsDays > 0, "measurementsDays must be positive: %s", measurementsDays);
    Preconditions.checkArgument(
        detectionsDays > 0, "detectionsDays must be positive: %s", detectionsDays);
    this.measurementsDays = measurementsDays;
    this.detectionsDays = detectionsDays;
  }

  public static RetentionPolicy defaultPolicy() {
    return new RetentionPolicy(DEFAULT_RETENTION_DAYS, DEFAULT_RETENTION_DAYS);
  }

  public Instant measurementsCutoff(Instant now) {
    return now.minus(Duration.ofDays(measurementsDays));
  }

  public Instant detectionsCutoff(Instant now) {
    return now.minus(Duration.ofDays(detectionsDays));
  }
}

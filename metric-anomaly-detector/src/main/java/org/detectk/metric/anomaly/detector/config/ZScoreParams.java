package org.detectk.metric.anomaly.detector.config;

import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Mean / standard-deviation bounds. */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ZScoreParams extends StatisticalParams {

  @Builder
  private ZScoreParams(
      Duration windowSize,
      Double nSigma,
      Integer minWindowSize,
      List<String> seasonalFeatures,
      Boolean useCombinedSeasonality,
      Boolean useWeighted,
      Double decayFactor) {
    super(
        windowSize,
        nSigma,
        minWindowSize,
        seasonalFeatures,
        useCombinedSeasonality,
        useWeighted,
        decayFactor);
  }

  public static ZScoreParams defaults() {
    return builder().build();
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.ZSCORE;
  }
}

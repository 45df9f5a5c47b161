package org.detectk.metric.anomaly.detector.config;

import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Median / median-absolute-deviation bounds. */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MadParams extends StatisticalParams {

  @Builder
  private MadParams(
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

  public static MadParams defaults() {
    return builder().build();
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.MAD;
  }
}

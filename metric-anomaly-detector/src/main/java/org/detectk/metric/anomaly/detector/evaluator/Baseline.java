package org.detectk.metric.anomaly.detector.evaluator;

import lombok.Value;

/** Center and spread of a history window, with the bounds they imply for a given n_sigma. */
@Value
public class Baseline {
  double center;
  double spread;
  double lowerBound;
  double upperBound;
  int windowPoints;

  public static Baseline of(double center, double spread, double nSigma, int windowPoints) {
    return new Baseline(
        center, spread, center - nSigma * spread, center + nSigma * spread, windowPoints);
  }

  public boolean isOutside(double value) {
    return value < lowerBound || value > upperBound;
  }

  /**
   * Distance from the center in units of spread. A zero spread makes any deviation infinitely far.
   */
  public double score(double value) {
    double deviation = Math.abs(value - center);
    if (spread == 0) {
      return deviation == 0 ? 0.0 : Double.POSITIVE_INFINITY;
    }
    return deviation / spread;
  }
}

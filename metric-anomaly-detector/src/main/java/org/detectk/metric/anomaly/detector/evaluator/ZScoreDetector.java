package org.detectk.metric.anomaly.detector.evaluator;

import org.detectk.metric.anomaly.detector.config.DetectorKind;
import org.detectk.metric.anomaly.detector.config.ZScoreParams;
import org.detectk.metric.anomaly.storage.MetricStorage;

public class ZScoreDetector extends BaselineDetector {

  public ZScoreDetector(String id, ZScoreParams params, MetricStorage storage) {
    super(id, params, storage);
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.ZSCORE;
  }

  @Override
  protected Baseline computeBaseline(double[] values) {
    double mean = StatisticsUtil.mean(values);
    return Baseline.of(
        mean, StatisticsUtil.standardDeviation(values, mean), params.getNSigma(), values.length);
  }

  @Override
  protected Baseline computeWeightedBaseline(double[] values, double[] weights) {
    double mean = StatisticsUtil.weightedMean(values, weights);
    return Baseline.of(
        mean,
        StatisticsUtil.weightedStandardDeviation(values, weights, mean),
        params.getNSigma(),
        values.length);
  }
}

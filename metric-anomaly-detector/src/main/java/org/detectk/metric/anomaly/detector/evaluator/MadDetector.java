package org.detectk.metric.anomaly.detector.evaluator;

import org.detectk.metric.anomaly.detector.config.DetectorKind;
import org.detectk.metric.anomaly.detector.config.MadParams;
import org.detectk.metric.anomaly.storage.MetricStorage;

/** Robust bounds: median center, scaled median absolute deviation as spread. */
public class MadDetector extends BaselineDetector {

  public MadDetector(String id, MadParams params, MetricStorage storage) {
    super(id, params, storage);
  }

  @Override
  public DetectorKind getKind() {
    return DetectorKind.MAD;
  }

  @Override
  protected Baseline computeBaseline(double[] values) {
    double center = StatisticsUtil.median(values);
    double spread =
        StatisticsUtil.MAD_SCALE * StatisticsUtil.medianAbsoluteDeviation(values, center);
    return Baseline.of(center, spread, params.getNSigma(), values.length);
  }

  @Override
  protected Baseline computeWeightedBaseline(double[] values, double[] weights) {
    double center = StatisticsUtil.weightedMedian(values, weights);
    double spread =
        StatisticsUtil.MAD_SCALE
            * StatisticsUtil.weightedMedianAbsoluteDeviation(values, weights, center);
    return Baseline.of(center, spread, params.getNSigma(), values.length);
  }
}

package org.detectk.metric.anomaly.detector.evaluator;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.Comparator;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Plain and weighted location/spread estimators over non-empty samples. Weighted median has no
 * commons-math counterpart and is computed here.
 */
public class StatisticsUtil {
  /** Scales MAD to a consistent estimator of the standard deviation for normal data. */
  public static final double MAD_SCALE = 1.4826;

  private StatisticsUtil() {}

  public static double median(double[] values) {
    Preconditions.checkArgument(values.length > 0, "median of empty sample");
    return new Median().evaluate(values);
  }

  public static double mean(double[] values) {
    Preconditions.checkArgument(values.length > 0, "mean of empty sample");
    return new Mean().evaluate(values);
  }

  /** Population standard deviation. */
  public static double standardDeviation(double[] values, double mean) {
    Preconditions.checkArgument(values.length > 0, "standard deviation of empty sample");
    return new StandardDeviation(false).evaluate(values, mean);
  }

  public static double medianAbsoluteDeviation(double[] values, double center) {
    return median(absoluteDeviations(values, center));
  }

  /** The first value, in ascending order, at which cumulative weight reaches half the total. */
  public static double weightedMedian(double[] values, double[] weights) {
    checkWeights(values, weights);
    Integer[] order = new Integer[values.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
    double half = StatUtils.sum(weights) / 2.0;
    double cumulative = 0;
    for (Integer index : order) {
      cumulative += weights[index];
      if (cumulative >= half) {
        return values[index];
      }
    }
    return values[order[order.length - 1]];
  }

  public static double weightedMean(double[] values, double[] weights) {
    checkWeights(values, weights);
    return new Mean().evaluate(values, weights);
  }

  /** Weighted population standard deviation around {@code mean}. */
  public static double weightedStandardDeviation(double[] values, double[] weights, double mean) {
    checkWeights(values, weights);
    return Math.sqrt(new Variance(false).evaluate(values, weights, mean));
  }

  public static double weightedMedianAbsoluteDeviation(
      double[] values, double[] weights, double center) {
    return weightedMedian(absoluteDeviations(values, center), weights);
  }

  /** Weight {@code exp(-decayFactor * age)} for each age. */
  public static double[] exponentialDecayWeights(double[] ages, double decayFactor) {
    double[] weights = new double[ages.length];
    for (int i = 0; i < ages.length; i++) {
      weights[i] = Math.exp(-decayFactor * ages[i]);
    }
    return weights;
  }

  /** True when the weights can normalise a weighted estimator: finite and summing above zero. */
  public static boolean hasUsableWeights(double[] weights) {
    double total = StatUtils.sum(weights);
    return Double.isFinite(total) && total > 0;
  }

  private static double[] absoluteDeviations(double[] values, double center) {
    double[] deviations = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - center);
    }
    return deviations;
  }

  private static void checkWeights(double[] values, double[] weights) {
    Preconditions.checkArgument(values.length > 0, "empty sample");
    Preconditions.checkArgument(
        values.length == weights.length,
        "sample has %s values but %s weights",
        values.length,
        weights.length);
    Preconditions.checkArgument(hasUsableWeights(weights), "weights sum to zero");
  }
}

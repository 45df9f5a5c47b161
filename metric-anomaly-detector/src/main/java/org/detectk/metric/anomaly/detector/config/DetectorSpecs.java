package org.detectk.metric.anomaly.detector.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

/**
 * Reads detector specs from resolved HOCON blocks:
 *
 * <pre>
 * detectors = [
 *   { kind = mad, params { window_size = 30d, seasonal_features = [hour_of_day] } }
 *   { kind = threshold, id = hard-limit, params { operator = gt, value = 1000 } }
 * ]
 * </pre>
 */
public class DetectorSpecs {
  private static final String KIND = "kind";
  private static final String ID = "id";
  private static final String PARAMS = "params";

  private DetectorSpecs() {}

  public static List<DetectorSpec> fromConfigList(List<? extends Config> detectorConfigs) {
    List<DetectorSpec> specs = new ArrayList<>();
    for (Config detectorConfig : detectorConfigs) {
      specs.add(fromConfig(detectorConfig));
    }
    return specs;
  }

  public static DetectorSpec fromConfig(Config detectorConfig) {
    try {
      DetectorKind kind = DetectorKind.fromLabel(detectorConfig.getString(KIND));
      String id = detectorConfig.hasPath(ID) ? detectorConfig.getString(ID) : null;
      Config params =
          detectorConfig.hasPath(PARAMS)
              ? detectorConfig.getConfig(PARAMS)
              : ConfigFactory.parseMap(Map.of());
      return new DetectorSpec(id, kind, paramsFromConfig(kind, params));
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid detector configuration: " + e.getMessage(), e);
    }
  }

  static DetectorParams paramsFromConfig(DetectorKind kind, Config params) {
    switch (kind) {
      case THRESHOLD:
        return thresholdParams(params);
      case MAD:
        return MadParams.builder()
            .windowSize(
                params.hasPath(StatisticalParams.WINDOW_SIZE)
                    ? params.getDuration(StatisticalParams.WINDOW_SIZE)
                    : null)
            .nSigma(doubleOrNull(params, StatisticalParams.N_SIGMA))
            .minWindowSize(intOrNull(params, StatisticalParams.MIN_WINDOW_SIZE))
            .seasonalFeatures(stringListOrNull(params, StatisticalParams.SEASONAL_FEATURES))
            .useCombinedSeasonality(
                booleanOrNull(params, StatisticalParams.USE_COMBINED_SEASONALITY))
            .useWeighted(booleanOrNull(params, StatisticalParams.USE_WEIGHTED))
            .decayFactor(doubleOrNull(params, StatisticalParams.DECAY_FACTOR))
            .build();
      case ZSCORE:
        return ZScoreParams.builder()
            .windowSize(
                params.hasPath(StatisticalParams.WINDOW_SIZE)
                    ? params.getDuration(StatisticalParams.WINDOW_SIZE)
                    : null)
            .nSigma(doubleOrNull(params, StatisticalParams.N_SIGMA))
            .minWindowSize(intOrNull(params, StatisticalParams.MIN_WINDOW_SIZE))
            .seasonalFeatures(stringListOrNull(params, StatisticalParams.SEASONAL_FEATURES))
            .useCombinedSeasonality(
                booleanOrNull(params, StatisticalParams.USE_COMBINED_SEASONALITY))
            .useWeighted(booleanOrNull(params, StatisticalParams.USE_WEIGHTED))
            .decayFactor(doubleOrNull(params, StatisticalParams.DECAY_FACTOR))
            .build();
      default:
        throw new ConfigurationException("Unsupported detector kind: " + kind);
    }
  }

  private static ThresholdParams thresholdParams(Config params) {
    return ThresholdParams.builder()
        .operator(
            params.hasPath(ThresholdParams.OPERATOR)
                ? ThresholdOperator.fromLabel(params.getString(ThresholdParams.OPERATOR))
                : null)
        .value(doubleOrNull(params, ThresholdParams.VALUE))
        .minValue(doubleOrNull(params, ThresholdParams.MIN_VALUE))
        .maxValue(doubleOrNull(params, ThresholdParams.MAX_VALUE))
        .percentChange(booleanOrNull(params, ThresholdParams.PERCENT_CHANGE))
        .baseline(
            params.hasPath(ThresholdParams.BASELINE)
                ? ChangeBaseline.fromLabel(params.getString(ThresholdParams.BASELINE))
                : null)
        .baselineWindow(
            params.hasPath(ThresholdParams.BASELINE_WINDOW)
                ? params.getDuration(ThresholdParams.BASELINE_WINDOW)
                : null)
        .build();
  }

  private static Double doubleOrNull(Config config, String path) {
    return config.hasPath(path) ? config.getDouble(path) : null;
  }

  private static Integer intOrNull(Config config, String path) {
    return config.hasPath(path) ? config.getInt(path) : null;
  }

  private static Boolean booleanOrNull(Config config, String path) {
    return config.hasPath(path) ? config.getBoolean(path) : null;
  }

  private static List<String> stringListOrNull(Config config, String path) {
    return config.hasPath(path) ? config.getStringList(path) : null;
  }
}

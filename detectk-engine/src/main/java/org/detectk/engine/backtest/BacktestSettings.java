package org.detectk.engine.backtest;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import lombok.Value;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;

/**
 * Time frame of a backtest. History in {@code [dataLoadStart, detectionStart)} feeds the detector
 * windows; checks run at every step from {@code detectionStart} up to and including {@code
 * detectionEnd}.
 */
@Value
public class BacktestSettings {
  public static final Duration DEFAULT_BATCH_SIZE = Duration.ofDays(30);

  private static final String DATA_LOAD_START = "dataLoadStart";
  private static final String DETECTION_START = "detectionStart";
  private static final String DETECTION_END = "detectionEnd";
  private static final String STEP = "step";
  private static final String BATCH_SIZE = "batchSize";
  private static final String BACKFILL = "backfill";

  Instant dataLoadStart;
  Instant detectionStart;
  Instant detectionEnd;
  Duration step;
  Duration batchSize;
  boolean backfill;

  public BacktestSettings(
      Instant dataLoadStart,
      Instant detectionStart,
      Instant detectionEnd,
      Duration step,
      Duration batchSize,
      boolean backfill) {
    if (!dataLoadStart.isBefore(detectionStart)) {
      throw new ConfigurationException(
          String.format(
              "dataLoadStart (%s) must be before detectionStart (%s)",
              dataLoadStart, detectionStart));
    }
    if (!detectionStart.isBefore(detectionEnd)) {
      throw new ConfigurationException(
          String.format(
              "detectionStart (%s) must be before detectionEnd (%s)",
              detectionStart, detectionEnd));
    }
    if (step.isNegative() || step.isZero()) {
      throw new ConfigurationException("Backtest step must be positive, got " + step);
    }
    if (batchSize.isNegative() || batchSize.isZero()) {
      throw new ConfigurationException("Backtest batch size must be positive, got " + batchSize);
    }
    this.dataLoadStart = dataLoadStart;
    this.detectionStart = detectionStart;
    this.detectionEnd = detectionEnd;
    this.step = step;
    this.batchSize = batchSize;
    this.backfill = backfill;
  }

  public static BacktestSettings of(
      Instant dataLoadStart, Instant detectionStart, Instant detectionEnd, Duration step) {
    return new BacktestSettings(
        dataLoadStart, detectionStart, detectionEnd, step, DEFAULT_BATCH_SIZE, true);
  }

  public static BacktestSettings from(Config config) {
    try {
      return new BacktestSettings(
          parseTime(config.getString(DATA_LOAD_START)),
          parseTime(config.getString(DETECTION_START)),
          parseTime(config.getString(DETECTION_END)),
          config.getDuration(STEP),
          config.hasPath(BATCH_SIZE) ? config.getDuration(BATCH_SIZE) : DEFAULT_BATCH_SIZE,
          !config.hasPath(BACKFILL) || config.getBoolean(BACKFILL));
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid backtest configuration: " + e.getMessage(), e);
    }
  }

  /** Number of checks the backtest runs. */
  public long getStepCount() {
    return Duration.between(detectionStart, detectionEnd).dividedBy(step) + 1;
  }

  // accepts an ISO instant or a plain date, read as midnight UTC
  static Instant parseTime(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      try {
        return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
      } catch (DateTimeParseException dateException) {
        throw new ConfigurationException("Invalid backtest time: " + value, dateException);
      }
    }
  }
}

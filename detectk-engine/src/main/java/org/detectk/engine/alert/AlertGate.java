package org.detectk.engine.alert;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.storage.AlertStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooldown timer per {@code (metric, detectorId)}. A key is cooling down while less than the
 * cooldown has elapsed since its last recorded dispatch. Dispatches are recorded by the caller once
 * the alerter has confirmed delivery, so a failed or interrupted send never starts a cooldown.
 */
public class AlertGate {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertGate.class);

  private final AlertStateStore stateStore;

  public AlertGate(AlertStateStore stateStore) {
    this.stateStore = stateStore;
  }

  public AlertDecision check(DetectionResult result, Duration cooldown, Instant now)
      throws StorageException {
    Preconditions.checkArgument(result.isAnomaly(), "Only anomalous results pass the alert gate");
    Preconditions.checkArgument(!cooldown.isNegative(), "Cooldown must not be negative");
    if (cooldown.isZero()) {
      return AlertDecision.PERMITTED;
    }
    Optional<Instant> lastDispatch =
        stateStore.lastDispatch(result.getMetricName(), result.getDetectorId());
    if (lastDispatch.isPresent()
        && Duration.between(lastDispatch.get(), now).compareTo(cooldown) < 0) {
      LOGGER.debug(
          "Suppressing alert for {}/{}: last dispatch {} within cooldown {}",
          result.getMetricName(),
          result.getDetectorId(),
          lastDispatch.get(),
          cooldown);
      return AlertDecision.SUPPRESSED_COOLDOWN;
    }
    return AlertDecision.PERMITTED;
  }

  public void recordDispatch(DetectionResult result, Instant dispatchedAt)
      throws StorageException {
    stateStore.recordDispatch(result.getMetricName(), result.getDetectorId(), dispatchedAt);
  }
}

package org.detectk.metric.anomaly.storage;

import java.time.Instant;
import java.util.Optional;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;

/** Last confirmed alert dispatch per {@code (metric, detectorId)}. */
public interface AlertStateStore {

  Optional<Instant> lastDispatch(String metricName, String detectorId) throws StorageException;

  void recordDispatch(String metricName, String detectorId, Instant dispatchedAt)
      throws StorageException;
}

package org.detectk.metric.anomaly.datamodel;

import java.time.Instant;
import java.util.List;
import org.detectk.metric.anomaly.datamodel.exception.CollectionException;

/**
 * Source of measurements for one metric. Implementations wrap a concrete data source (SQL query,
 * HTTP endpoint, ...) and may return any number of points for a period, including none.
 */
public interface Collector {

  /** Returns the measurements in {@code [periodStart, periodEnd)}, ordered by timestamp. */
  List<Measurement> collect(Instant periodStart, Instant periodEnd) throws CollectionException;
}

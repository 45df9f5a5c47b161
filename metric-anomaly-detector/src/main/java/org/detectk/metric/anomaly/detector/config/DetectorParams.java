package org.detectk.metric.anomaly.detector.config;

import java.util.Map;

/** Validated parameters of one detector kind. */
public interface DetectorParams {

  DetectorKind getKind();

  /**
   * Effective parameters keyed by their configuration names, defaults included. This is the input
   * of detector id derivation.
   */
  Map<String, Object> toParamMap();
}

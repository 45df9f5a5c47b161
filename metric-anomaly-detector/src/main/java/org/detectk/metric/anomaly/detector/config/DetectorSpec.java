package org.detectk.metric.anomaly.detector.config;

import static org.detectk.metric.anomaly.detector.config.ParamChecks.require;

import java.util.Optional;
import lombok.Value;

/**
 * One configured detector for a metric. The id is optional here: specs without one get a derived
 * id when they are registered.
 */
@Value
public class DetectorSpec {
  String id;
  DetectorKind kind;
  DetectorParams params;

  public DetectorSpec(String id, DetectorKind kind, DetectorParams params) {
    require(kind != null, "detector kind is required");
    require(params != null, "detector params are required for kind %s", kind.getLabel());
    require(
        params.getKind() == kind,
        "params of kind %s given for detector kind %s",
        params.getKind().getLabel(),
        kind.getLabel());
    require(id == null || !id.isBlank(), "detector id must not be blank");
    this.id = id;
    this.kind = kind;
    this.params = params;
  }

  public static DetectorSpec of(DetectorParams params) {
    return new DetectorSpec(null, params.getKind(), params);
  }

  public static DetectorSpec of(String id, DetectorParams params) {
    return new DetectorSpec(id, params.getKind(), params);
  }

  public Optional<String> getExplicitId() {
    return Optional.ofNullable(id);
  }

  public DetectorSpec withId(String resolvedId) {
    return new DetectorSpec(resolvedId, kind, params);
  }
}

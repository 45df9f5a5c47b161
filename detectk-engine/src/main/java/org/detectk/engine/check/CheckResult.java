package org.detectk.engine.check;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import lombok.NonNull;
import lombok.Value;
import org.detectk.metric.anomaly.datamodel.DetectionResult;

/**
 * Aggregated outcome of one check invocation. Every attempted stage is listed in a deterministic
 * order: collection, storage, detection by detector spec order then timestamp, alerts in the same
 * order, detection storage.
 */
@Value
public class CheckResult {
  @NonNull String metricName;
  @NonNull Instant executionTime;
  @NonNull List<StageOutcome> stages;
  @NonNull List<DetectionResult> detections;
  int alertsSent;

  public boolean isSuccessful() {
    return stages.stream().noneMatch(StageOutcome::isFailed);
  }

  public List<StageOutcome> getStages(PipelineStage stage) {
    return stages.stream().filter(s -> s.getStage() == stage).collect(Collectors.toList());
  }

  public List<StageOutcome> getFailures() {
    return stages.stream().filter(StageOutcome::isFailed).collect(Collectors.toList());
  }

  public boolean hasFailed(PipelineStage stage) {
    return getStages(stage).stream().anyMatch(StageOutcome::isFailed);
  }

  public List<DetectionResult> getAnomalies() {
    return detections.stream().filter(DetectionResult::isAnomaly).collect(Collectors.toList());
  }
}

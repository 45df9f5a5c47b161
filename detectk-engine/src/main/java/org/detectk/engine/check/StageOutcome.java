package org.detectk.engine.check;

import java.time.Instant;
import java.util.Optional;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of one attempted stage. Detection and alert outcomes carry the detector id and the
 * timestamp of the evaluated measurement; collection and storage stages carry neither.
 */
@Value
public class StageOutcome {
  @NonNull PipelineStage stage;
  String detectorId;
  Instant timestamp;
  @NonNull StageStatus status;
  String message;

  public static StageOutcome succeeded(PipelineStage stage, String message) {
    return new StageOutcome(stage, null, null, StageStatus.SUCCEEDED, message);
  }

  public static StageOutcome failed(PipelineStage stage, String message) {
    return new StageOutcome(stage, null, null, StageStatus.FAILED, message);
  }

  public static StageOutcome skipped(PipelineStage stage, String message) {
    return new StageOutcome(stage, null, null, StageStatus.SKIPPED, message);
  }

  public static StageOutcome forDetector(
      PipelineStage stage,
      String detectorId,
      Instant timestamp,
      StageStatus status,
      String message) {
    return new StageOutcome(stage, detectorId, timestamp, status, message);
  }

  public Optional<String> getDetectorId() {
    return Optional.ofNullable(detectorId);
  }

  public Optional<Instant> getTimestamp() {
    return Optional.ofNullable(timestamp);
  }

  public boolean isFailed() {
    return status == StageStatus.FAILED;
  }
}

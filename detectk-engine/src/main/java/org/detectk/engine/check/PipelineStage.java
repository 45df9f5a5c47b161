package org.detectk.engine.check;

/** Stages of one metric check, in execution order. */
public enum PipelineStage {
  COLLECTION,
  STORAGE,
  DETECTION,
  ALERT,
  DETECTION_STORAGE
}

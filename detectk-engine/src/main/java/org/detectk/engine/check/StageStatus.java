package org.detectk.engine.check;

public enum StageStatus {
  SUCCEEDED,
  FAILED,
  SKIPPED
}

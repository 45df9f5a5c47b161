package org.detectk.engine.alert;

public enum AlertDecision {
  PERMITTED,
  SUPPRESSED_COOLDOWN
}

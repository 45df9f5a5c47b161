package org.detectk.metric.anomaly.datamodel;

public enum Direction {
  UP("up"),
  DOWN("down");

  private final String label;

  Direction(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static Direction fromLabel(String label) {
    for (Direction direction : values()) {
      if (direction.label.equals(label)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Unknown direction: " + label);
  }
}

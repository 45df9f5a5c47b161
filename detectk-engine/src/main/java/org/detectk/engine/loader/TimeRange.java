package org.detectk.engine.loader;

import com.google.common.base.Preconditions;
import java.time.Instant;
import lombok.Value;

/** Half-open interval {@code [start, end)}. */
@Value
public class TimeRange {
  Instant start;
  Instant end;

  public TimeRange(Instant start, Instant end) {
    Preconditions.checkArgument(
        start.isBefore(end), "Range start %s must be before end %s", start, end);
    this.start = start;
    this.end = end;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}

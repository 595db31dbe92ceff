package com.scholary.video.splitter.splitting;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Plans equal-length, contiguous parts over a source duration.
 *
 * <p>Every part but the last is {@code duration / parts} long. The last part runs to the end of
 * the source, so rounding never drops the tail.
 */
@Component
public class SplitPlanner {

  public List<TimeRange> planParts(double durationSeconds, int parts) {
    if (!(durationSeconds > 0) || Double.isInfinite(durationSeconds)) {
      throw new IllegalArgumentException("Duration must be positive: " + durationSeconds);
    }
    if (parts < 1) {
      throw new IllegalArgumentException("Part count must be positive: " + parts);
    }

    double partLength = durationSeconds / parts;
    List<TimeRange> ranges = new ArrayList<>(parts);
    for (int index = 0; index < parts; index++) {
      double start = partLength * index;
      double end = index == parts - 1 ? durationSeconds : start + partLength;
      ranges.add(new TimeRange(start, end));
    }
    return ranges;
  }
}

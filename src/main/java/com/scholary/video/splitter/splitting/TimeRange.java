package com.scholary.video.splitter.splitting;

/**
 * Represents a time range in seconds with start and end points.
 *
 * <p>Used for part boundaries. All times are in seconds with fractional precision.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }
}

package com.scholary.video.splitter.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a split job.
 *
 * <p>A job starts {@link #PROCESSING} and moves once to {@link #COMPLETED} or {@link #ERROR}.
 */
public enum JobStatus {
  PROCESSING,
  COMPLETED,
  ERROR;

  public boolean isTerminal() {
    return this != PROCESSING;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Job status is required");
    }
    return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

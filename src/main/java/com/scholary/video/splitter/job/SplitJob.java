package com.scholary.video.splitter.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted record of a split job.
 *
 * <p>One record exists per job and is stored as the job directory's {@code metadata.json}.
 * Records are immutable; transitions return a new record. The status only ever moves from
 * {@code processing} to a terminal value, and {@link #complete} / {@link #fail} refuse to run
 * on a record that is already terminal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SplitJob(
    @JsonProperty("id") String id,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("original_filename") String originalFilename,
    @JsonProperty("part_count") int partCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("outputs") List<String> outputs,
    @JsonProperty("error_message") String errorMessage) {

  public SplitJob {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    outputs = outputs == null ? List.of() : List.copyOf(outputs);
  }

  /** Initial record written at submission time. */
  public static SplitJob processing(
      String id, String originalFilename, int partCount, Instant createdAt) {
    return new SplitJob(
        id, JobStatus.PROCESSING, originalFilename, partCount, createdAt, null, List.of(), null);
  }

  public SplitJob complete(List<String> outputFiles, Instant now) {
    requireProcessing(JobStatus.COMPLETED);
    return new SplitJob(
        id, JobStatus.COMPLETED, originalFilename, partCount, createdAt, now, outputFiles, null);
  }

  public SplitJob fail(String message, Instant now) {
    requireProcessing(JobStatus.ERROR);
    return new SplitJob(
        id, JobStatus.ERROR, originalFilename, partCount, createdAt, now, List.of(), message);
  }

  /** Replaces the output listing only; status and every other field are kept. */
  public SplitJob withOutputs(List<String> outputFiles) {
    return new SplitJob(
        id, status, originalFilename, partCount, createdAt, completedAt, outputFiles, errorMessage);
  }

  private void requireProcessing(JobStatus target) {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          String.format("Job %s is already %s, cannot move to %s", id, status.wireName(),
              target.wireName()));
    }
  }
}

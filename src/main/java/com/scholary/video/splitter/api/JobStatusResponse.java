package com.scholary.video.splitter.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.video.splitter.job.SplitJob;
import com.scholary.video.splitter.service.JobStatusView;
import java.util.List;

/**
 * Response for a job status query.
 *
 * <p>Carries the persisted record as {@code metadata} and the downloadable output names as
 * {@code files}. An unknown job is reported with status {@code not-found} and nothing else.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status") String status,
    @JsonProperty("metadata") SplitJob metadata,
    @JsonProperty("files") List<String> files) {

  public static final String NOT_FOUND = "not-found";

  public static JobStatusResponse from(JobStatusView view) {
    return new JobStatusResponse(
        view.jobId(), view.status().wireName(), view.record(), view.outputFiles());
  }

  public static JobStatusResponse notFound(String jobId) {
    return new JobStatusResponse(jobId, NOT_FOUND, null, null);
  }
}

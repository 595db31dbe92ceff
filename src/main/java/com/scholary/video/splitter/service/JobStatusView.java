package com.scholary.video.splitter.service;

import com.scholary.video.splitter.job.JobStatus;
import com.scholary.video.splitter.job.SplitJob;
import java.util.List;

/** Query-time view of a job. {@code outputFiles} is empty unless the job is completed. */
public record JobStatusView(
    String jobId, JobStatus status, SplitJob record, List<String> outputFiles) {

  public JobStatusView {
    outputFiles = outputFiles == null ? List.of() : List.copyOf(outputFiles);
  }
}

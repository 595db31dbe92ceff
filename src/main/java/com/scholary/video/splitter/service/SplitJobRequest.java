package com.scholary.video.splitter.service;

import com.scholary.video.splitter.job.SplitJob;
import java.nio.file.Path;

/**
 * A validated job handed to the runner.
 *
 * <p>{@code sourcePath} lives in the job's transient upload directory and is deleted once the
 * job reaches a terminal state.
 */
public record SplitJobRequest(
    String jobId, Path sourcePath, Path outputDir, int partCount, SplitJob initialRecord) {}

package com.scholary.video.splitter.api;

/**
 * Response for a split submission.
 *
 * <p>Returns the job ID and the URL to poll for its status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}

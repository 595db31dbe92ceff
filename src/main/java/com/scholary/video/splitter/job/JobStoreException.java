package com.scholary.video.splitter.job;

/**
 * Exception thrown when a job record cannot be written.
 *
 * <p>Reads never throw this: a missing or unreadable record is reported as absent.
 */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message) {
    super(message);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

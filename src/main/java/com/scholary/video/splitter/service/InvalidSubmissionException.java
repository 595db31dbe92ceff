package com.scholary.video.splitter.service;

/**
 * Exception thrown when a submission is rejected before a job is created.
 *
 * <p>The message is meant for the submitter and never contains internal details.
 */
public class InvalidSubmissionException extends RuntimeException {

  public InvalidSubmissionException(String message) {
    super(message);
  }
}

package com.scholary.video.splitter.splitting;

/** Thrown when a source has no readable, positive duration. */
public class DurationUnavailableException extends SplitException {

  public DurationUnavailableException(String message) {
    super(message);
  }

  public DurationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

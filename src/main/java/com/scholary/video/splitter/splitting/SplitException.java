package com.scholary.video.splitter.splitting;

/**
 * Base class for classified splitting failures.
 *
 * <p>Subclasses tell the job runner how a failure should be recorded. Anything that is not a
 * {@code SplitException} is treated as unexpected.
 */
public abstract class SplitException extends RuntimeException {

  protected SplitException(String message) {
    super(message);
  }

  protected SplitException(String message, Throwable cause) {
    super(message, cause);
  }
}

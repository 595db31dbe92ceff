package com.scholary.video.splitter.splitting;

/**
 * Thrown when ffmpeg or ffprobe exits with a non-zero code.
 *
 * <p>{@link #diagnostic()} carries the tool's stderr, trimmed and truncated so it can be stored
 * in a job record.
 */
public class ExternalToolException extends SplitException {

  private final int exitCode;
  private final String diagnostic;

  public ExternalToolException(String message, int exitCode, String diagnostic) {
    super(message);
    this.exitCode = exitCode;
    this.diagnostic = diagnostic;
  }

  public int exitCode() {
    return exitCode;
  }

  public String diagnostic() {
    return diagnostic;
  }
}

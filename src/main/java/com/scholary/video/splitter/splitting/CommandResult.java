package com.scholary.video.splitter.splitting;

import java.time.Duration;

/** Outcome of an external command: exit code, captured output, and wall time. */
public record CommandResult(int exitCode, String stdout, String stderr, Duration elapsed) {

  public CommandResult {
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }

  public boolean succeeded() {
    return exitCode == 0;
  }
}

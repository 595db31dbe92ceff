package com.scholary.video.splitter.splitting;

import java.io.IOException;
import java.util.List;

/** Runs an external command to completion and captures its output. */
public interface CommandRunner {

  /**
   * Run {@code command} and wait for it to exit.
   *
   * @param command program and arguments
   * @param description short label used in logs
   * @return the exit code and captured output; a non-zero exit is not an exception here
   * @throws IOException if the process cannot be started or is interrupted
   */
  CommandResult run(List<String> command, String description) throws IOException;
}

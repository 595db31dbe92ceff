package com.scholary.video.splitter.splitting;

import com.scholary.video.splitter.logging.StructuredLogger;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs commands with {@link ProcessBuilder}.
 *
 * <p>stdin is closed immediately. stderr is drained on a separate thread while stdout is read on
 * the calling thread, so a chatty tool cannot fill one pipe and block.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  @Override
  public CommandResult run(List<String> command, String description) throws IOException {
    LOGGER.info("Running {}: {}", description, String.join(" ", command));
    long startTime = System.nanoTime();

    Process process = new ProcessBuilder(command).start();
    return collect(process, description, startTime);
  }

  /** Waits for {@code process}, killing it if its output cannot be read. */
  CommandResult collect(Process process, String description, long startTime)
      throws IOException {
    process.getOutputStream().close();

    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(() -> readUnchecked(process.getErrorStream()));

    String stdout;
    int exitCode;
    String errorOutput;
    try {
      stdout = read(process.getInputStream());
      exitCode = process.waitFor();
      errorOutput = stderr.get();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      stderr.cancel(true);
      Thread.currentThread().interrupt();
      throw new IOException(description + " interrupted", e);
    } catch (ExecutionException e) {
      process.destroyForcibly();
      throw new IOException("Failed to read stderr of " + description, e.getCause());
    } catch (IOException e) {
      process.destroyForcibly();
      stderr.cancel(true);
      throw new IOException("Failed to read stdout of " + description, e);
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - startTime);
    structuredLogger.logCommandFinished(description, exitCode, elapsed.toMillis());

    if (!stdout.isBlank()) {
      LOGGER.debug("{} stdout: {}", description, stdout.strip());
    }
    if (!errorOutput.isBlank()) {
      LOGGER.warn("{} stderr: {}", description, errorOutput.strip());
    }

    return new CommandResult(exitCode, stdout, errorOutput, elapsed);
  }

  private static String read(InputStream stream) throws IOException {
    try (InputStream in = stream) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static String readUnchecked(InputStream stream) {
    try {
      return read(stream);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

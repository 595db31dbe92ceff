package com.scholary.video.splitter.service;

import com.scholary.video.splitter.config.AsyncConfig;
import com.scholary.video.splitter.job.JobLocks;
import com.scholary.video.splitter.job.JobMetadataStore;
import com.scholary.video.splitter.job.SplitJob;
import com.scholary.video.splitter.logging.StructuredLogger;
import com.scholary.video.splitter.splitting.DurationUnavailableException;
import com.scholary.video.splitter.splitting.ExternalToolException;
import com.scholary.video.splitter.splitting.VideoSplitter;
import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Executes split jobs on the bounded worker pool.
 *
 * <p>Each job runs strictly in sequence: split, one terminal record write, cleanup of the
 * transient upload. The terminal write happens under the job's lock and never replaces a record
 * that is already terminal. Cleanup runs on every exit path after the write and only logs its
 * own failures.
 *
 * <p>Nothing is thrown back to the submitter; outcomes are visible only through the record.
 */
@Service
public class SplitJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SplitJobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String UNEXPECTED_ERROR_MESSAGE = "Unexpected error while processing the video.";
  static final String TOOL_FAILURE_MESSAGE = "External tool failed.";
  static final String NOT_SCHEDULED_MESSAGE = "Job could not be scheduled.";

  private final VideoSplitter splitter;
  private final JobMetadataStore store;
  private final JobLocks locks;
  private final Executor executor;

  public SplitJobRunner(
      VideoSplitter splitter,
      JobMetadataStore store,
      JobLocks locks,
      @Qualifier(AsyncConfig.SPLIT_EXECUTOR) Executor executor) {
    this.splitter = splitter;
    this.store = store;
    this.locks = locks;
    this.executor = executor;
  }

  /**
   * Queue a job on the worker pool and return immediately.
   *
   * <p>If the pool refuses the job (saturated or shut down) it is recorded as failed straight
   * away and its upload is removed.
   */
  public void submit(SplitJobRequest request) {
    try {
      executor.execute(() -> run(request));
      LOGGER.debug("Queued job {}", request.jobId());
    } catch (RejectedExecutionException e) {
      structuredLogger.logJobFailed(request.jobId(), "rejected", e.getMessage(), null);
      persistTerminal(request, job -> job.fail(NOT_SCHEDULED_MESSAGE, Instant.now()));
      cleanup(request);
    }
  }

  void run(SplitJobRequest request) {
    StructuredLogger.setJobContext(
        request.jobId(), request.initialRecord().originalFilename(), request.partCount());
    LOGGER.info("Starting background processing for job {}", request.jobId());
    try {
      persistTerminal(request, execute(request));
    } finally {
      cleanup(request);
      StructuredLogger.clearJobContext();
    }
  }

  /** Run the splitter and classify the outcome as a terminal transition. Never throws. */
  private UnaryOperator<SplitJob> execute(SplitJobRequest request) {
    long startTime = System.currentTimeMillis();
    try {
      List<String> outputs =
          splitter.split(request.sourcePath(), request.outputDir(), request.partCount());
      structuredLogger.logJobCompleted(
          request.jobId(), outputs.size(), System.currentTimeMillis() - startTime);
      return job -> job.complete(outputs, Instant.now());

    } catch (ExternalToolException e) {
      structuredLogger.logJobFailed(
          request.jobId(), "external_tool", e.getMessage() + ": " + e.diagnostic(), null);
      String message =
          e.diagnostic() == null || e.diagnostic().isBlank()
              ? TOOL_FAILURE_MESSAGE
              : e.diagnostic();
      return job -> job.fail(message, Instant.now());

    } catch (DurationUnavailableException e) {
      structuredLogger.logJobFailed(request.jobId(), "duration_unavailable", e.getMessage(), null);
      return job -> job.fail(e.getMessage(), Instant.now());

    } catch (IOException | RuntimeException e) {
      structuredLogger.logJobFailed(request.jobId(), "unexpected", e.getMessage(), e);
      return job -> job.fail(UNEXPECTED_ERROR_MESSAGE, Instant.now());
    }
  }

  private void persistTerminal(SplitJobRequest request, UnaryOperator<SplitJob> transition) {
    String jobId = request.jobId();
    try {
      locks.withLock(
          jobId,
          () -> {
            SplitJob current = store.get(jobId).orElse(request.initialRecord());
            if (current.status().isTerminal()) {
              LOGGER.warn(
                  "Job {} is already {}, keeping the recorded outcome",
                  jobId,
                  current.status().wireName());
              return current;
            }
            SplitJob terminal = transition.apply(current);
            store.put(jobId, terminal);
            return terminal;
          });
    } catch (RuntimeException e) {
      LOGGER.error("Failed to persist terminal record for job {}", jobId, e);
    }
  }

  private void cleanup(SplitJobRequest request) {
    Path source = request.sourcePath();
    try {
      Files.deleteIfExists(source);
    } catch (IOException e) {
      structuredLogger.logCleanupFailed(request.jobId(), source.toString(), e);
    }

    Path uploadDir = source.getParent();
    if (uploadDir == null) {
      return;
    }
    try {
      Files.delete(uploadDir);
    } catch (DirectoryNotEmptyException e) {
      LOGGER.debug("Upload directory {} not removed (not empty)", uploadDir);
    } catch (NoSuchFileException e) {
      LOGGER.debug("Upload directory {} already removed", uploadDir);
    } catch (IOException e) {
      structuredLogger.logCleanupFailed(request.jobId(), uploadDir.toString(), e);
    }
  }
}

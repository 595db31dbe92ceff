package com.scholary.video.splitter.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method logs one job lifecycle event and tags it with {@code event_type} plus
 * event-specific fields, so events can be filtered by field in a log pipeline.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job submitted event. */
  public void logJobSubmitted(String jobId, String filename, int parts) {
    try {
      MDC.put("event_type", "job_submitted");

      logger.info("Job submitted: jobId={}, file={}, parts={}", jobId, filename, parts);
    } finally {
      clearEventFields();
    }
  }

  /** Log job completed event. */
  public void logJobCompleted(String jobId, int outputCount, long elapsedMs) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("outputCount", String.valueOf(outputCount));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Job completed: jobId={}, outputs={}, elapsed={}ms", jobId, outputCount, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failed event. The cause, if any, is logged with its stack trace. */
  public void logJobFailed(String jobId, String errorType, String message, Throwable cause) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);

      if (cause != null) {
        logger.error(
            "Job failed: jobId={}, error={}, message={}", jobId, errorType, message, cause);
      } else {
        logger.error("Job failed: jobId={}, error={}, message={}", jobId, errorType, message);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log external command finished event. */
  public void logCommandFinished(String description, int exitCode, long elapsedMs) {
    try {
      MDC.put("event_type", "command_finished");
      MDC.put("command", description);
      MDC.put("exitCode", String.valueOf(exitCode));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Finished {} in {}ms (exit code {})", description, elapsedMs, exitCode);
    } finally {
      clearEventFields();
    }
  }

  /** Log cleanup failure event. */
  public void logCleanupFailed(String jobId, String path, Throwable cause) {
    try {
      MDC.put("event_type", "cleanup_failed");
      MDC.put("path", path);

      logger.warn("Unable to remove {} after processing job {}", path, jobId, cause);
    } finally {
      clearEventFields();
    }
  }

  /** Log metadata self-heal event. */
  public void logOutputsHealed(String jobId, int persistedCount, int derivedCount) {
    try {
      MDC.put("event_type", "outputs_healed");
      MDC.put("persistedCount", String.valueOf(persistedCount));
      MDC.put("derivedCount", String.valueOf(derivedCount));

      logger.info(
          "Corrected outputs for job {}: persisted={}, derived={}",
          jobId,
          persistedCount,
          derivedCount);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String filename, int parts) {
    MDC.put("jobId", jobId);
    MDC.put("filename", filename);
    MDC.put("parts", String.valueOf(parts));
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("filename");
    MDC.remove("parts");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("outputCount");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("command");
    MDC.remove("exitCode");
    MDC.remove("path");
    MDC.remove("persistedCount");
    MDC.remove("derivedCount");
  }
}

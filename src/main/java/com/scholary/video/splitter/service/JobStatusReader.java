package com.scholary.video.splitter.service;

import com.scholary.video.splitter.job.JobLocks;
import com.scholary.video.splitter.job.JobMetadataStore;
import com.scholary.video.splitter.job.JobStatus;
import com.scholary.video.splitter.job.SplitJob;
import com.scholary.video.splitter.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds query-time views of jobs.
 *
 * <p>For a completed job whose record lists no outputs (older records, or a record written
 * before its outputs were known), the output files are derived from the job directory instead.
 * The derived listing is returned right away and written back to the record under the job's
 * lock, but only if the freshly read record is still completed and still has no outputs. The
 * correction never changes the status.
 */
@Service
public class JobStatusReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStatusReader.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobMetadataStore store;
  private final JobLocks locks;

  public JobStatusReader(JobMetadataStore store, JobLocks locks) {
    this.store = store;
    this.locks = locks;
  }

  /**
   * Look up a job.
   *
   * @param jobId the job identifier
   * @return the job's view, or empty if no readable record exists
   */
  public Optional<JobStatusView> query(String jobId) {
    if (!store.exists(jobId)) {
      return Optional.empty();
    }
    Optional<SplitJob> found = store.get(jobId);
    if (found.isEmpty()) {
      return Optional.empty();
    }

    SplitJob job = found.get();
    if (job.status() != JobStatus.COMPLETED) {
      return Optional.of(new JobStatusView(jobId, job.status(), job, List.of()));
    }

    List<String> files = job.outputs().isEmpty() ? listOutputFiles(jobId) : job.outputs();
    if (!files.equals(job.outputs())) {
      job = job.withOutputs(files);
      persistOutputs(jobId, files);
    }
    return Optional.of(new JobStatusView(jobId, JobStatus.COMPLETED, job, files));
  }

  private List<String> listOutputFiles(String jobId) {
    Path dir = store.jobDirectory(jobId);
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(name -> !name.equals(JobMetadataStore.METADATA_FILENAME))
          .filter(name -> !name.equals(JobMetadataStore.TEMP_FILENAME))
          .sorted()
          .toList();
    } catch (IOException e) {
      LOGGER.error("Failed to list outputs for job {} in {}", jobId, dir, e);
      return List.of();
    }
  }

  private void persistOutputs(String jobId, List<String> files) {
    try {
      locks.withLock(
          jobId,
          () -> {
            Optional<SplitJob> fresh = store.get(jobId);
            if (fresh.isPresent()
                && fresh.get().status() == JobStatus.COMPLETED
                && fresh.get().outputs().isEmpty()) {
              store.put(jobId, fresh.get().withOutputs(files));
              structuredLogger.logOutputsHealed(jobId, 0, files.size());
            }
            return null;
          });
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to persist corrected outputs for job {}", jobId, e);
    }
  }
}

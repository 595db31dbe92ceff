package com.scholary.video.splitter.service;

import com.scholary.video.splitter.config.SplitterProperties;
import com.scholary.video.splitter.config.StorageConfig.StorageLayout;
import com.scholary.video.splitter.job.JobMetadataStore;
import com.scholary.video.splitter.job.JobStoreException;
import com.scholary.video.splitter.job.SplitJob;
import com.scholary.video.splitter.logging.StructuredLogger;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts split submissions.
 *
 * <p>A submission is validated first; an invalid one is rejected before anything touches the
 * disk. A valid one gets a fresh job id, its upload is stored in a transient directory, the
 * initial {@code processing} record is persisted, and the job is queued on the runner. The call
 * returns as soon as the job is queued.
 */
@Service
public class SplitJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SplitJobService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final SplitterProperties properties;
  private final StorageLayout storageLayout;
  private final JobMetadataStore store;
  private final SplitJobRunner runner;

  public SplitJobService(
      SplitterProperties properties,
      StorageLayout storageLayout,
      JobMetadataStore store,
      SplitJobRunner runner) {
    this.properties = properties;
    this.storageLayout = storageLayout;
    this.store = store;
    this.runner = runner;
  }

  /**
   * Validate and queue a split job.
   *
   * @param originalFilename the name the caller gave the upload
   * @param content the upload's bytes
   * @param parts requested number of parts
   * @return the initial record of the new job
   * @throws InvalidSubmissionException if the submission is rejected; no job is created
   * @throws IOException if the upload cannot be stored; no job is created
   * @throws JobStoreException if the initial record cannot be written; no job is created
   */
  public SplitJob submit(String originalFilename, InputStream content, Integer parts)
      throws IOException {
    validate(originalFilename, parts);

    String extension = FilenameSanitizer.extensionOf(originalFilename);
    String filename = FilenameSanitizer.sanitize(originalFilename);
    if (!extension.equals(FilenameSanitizer.extensionOf(filename))) {
      filename = "upload." + extension;
    }

    String jobId = UUID.randomUUID().toString().replace("-", "");
    Path uploadDir = storageLayout.uploadRoot().resolve(jobId);
    Path outputDir = store.jobDirectory(jobId);
    Path source = uploadDir.resolve(filename);

    try {
      Files.createDirectories(uploadDir);
      Files.createDirectories(outputDir);
      LOGGER.info("Saving uploaded file to {}", source);
      Files.copy(content, source);
    } catch (IOException e) {
      LOGGER.error("Failed to store upload for job {}", jobId, e);
      deleteQuietly(uploadDir);
      deleteQuietly(outputDir);
      throw e;
    }

    SplitJob initial = SplitJob.processing(jobId, filename, parts, Instant.now());
    try {
      store.put(jobId, initial);
    } catch (JobStoreException e) {
      deleteQuietly(uploadDir);
      deleteQuietly(outputDir);
      throw e;
    }
    structuredLogger.logJobSubmitted(jobId, filename, parts);

    runner.submit(new SplitJobRequest(jobId, source, outputDir, parts, initial));
    return initial;
  }

  private void validate(String originalFilename, Integer parts) {
    if (originalFilename == null || originalFilename.isBlank()) {
      throw new InvalidSubmissionException("Please choose a video file to upload.");
    }
    if (!properties.isAllowedExtension(FilenameSanitizer.extensionOf(originalFilename))) {
      throw new InvalidSubmissionException(
          String.format(
              "Only %s files are supported.",
              String.join(", ", properties.allowedExtensions())));
    }
    if (parts == null || !properties.isAllowedPartCount(parts)) {
      throw new InvalidSubmissionException(
          String.format(
              "Please choose between %d and %d parts.",
              properties.minParts(), properties.maxParts()));
    }
  }

  private static void deleteQuietly(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> entries = Files.walk(dir)) {
      for (Path path : entries.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      LOGGER.warn("Unable to remove {} after a failed submission", dir, e);
    }
  }
}

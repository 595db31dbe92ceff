package com.scholary.video.splitter.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.scholary.video.splitter.config.StorageConfig.StorageLayout;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * File-backed store for job records.
 *
 * <p>Each job owns a directory under the output root holding a single {@code metadata.json}
 * document next to the job's output files. Writes go to a temporary sibling first and are then
 * moved over the canonical document in one atomic rename, so a reader (or a crash) only ever sees
 * the previous document or the new one.
 *
 * <p>Reads are forgiving: a missing, unreadable, or unparseable document is reported as absent
 * and logged, never thrown.
 */
@Repository
public class JobMetadataStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobMetadataStore.class);

  public static final String METADATA_FILENAME = "metadata.json";
  public static final String TEMP_FILENAME = METADATA_FILENAME + ".tmp";

  private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

  private final Path outputRoot;
  private final ObjectMapper objectMapper;

  public JobMetadataStore(StorageLayout storageLayout, ObjectMapper objectMapper) {
    this.outputRoot = storageLayout.outputRoot();
    this.objectMapper =
        objectMapper
            .copy()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public static boolean isValidJobId(String jobId) {
    return jobId != null && JOB_ID_PATTERN.matcher(jobId).matches();
  }

  /**
   * Resolve the directory that holds a job's record and outputs.
   *
   * @throws IllegalArgumentException if the id is not a plain single path segment
   */
  public Path jobDirectory(String jobId) {
    if (!isValidJobId(jobId)) {
      throw new IllegalArgumentException("Invalid job id: " + jobId);
    }
    return outputRoot.resolve(jobId);
  }

  public boolean exists(String jobId) {
    return isValidJobId(jobId) && Files.isDirectory(jobDirectory(jobId));
  }

  /**
   * Durably replace the record for a job.
   *
   * @throws JobStoreException if the document cannot be written or moved into place
   */
  public void put(String jobId, SplitJob job) {
    Path dir = jobDirectory(jobId);
    Path target = dir.resolve(METADATA_FILENAME);
    Path temp = dir.resolve(TEMP_FILENAME);

    byte[] document;
    try {
      document = objectMapper.writeValueAsBytes(job);
    } catch (JsonProcessingException e) {
      throw new JobStoreException("Failed to serialize record for job " + jobId, e);
    }

    try {
      Files.createDirectories(dir);
      Files.write(temp, document);
      moveIntoPlace(temp, target);
    } catch (IOException e) {
      throw new JobStoreException("Failed to write record for job " + jobId, e);
    }

    LOGGER.info("Saved metadata for job {} (status={})", jobId, job.status().wireName());
  }

  public Optional<SplitJob> get(String jobId) {
    if (!isValidJobId(jobId)) {
      return Optional.empty();
    }
    Path document = jobDirectory(jobId).resolve(METADATA_FILENAME);
    if (!Files.isRegularFile(document)) {
      return Optional.empty();
    }

    try {
      SplitJob job = objectMapper.readValue(document.toFile(), SplitJob.class);
      if (job == null) {
        LOGGER.error("Failed to parse metadata at {}: document is null", document);
      }
      return Optional.ofNullable(job);
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to parse metadata at {}", document, e);
      return Optional.empty();
    } catch (IOException e) {
      LOGGER.error("Failed to read metadata at {}", document, e);
      return Optional.empty();
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.warn("Atomic move not supported for {}, falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}

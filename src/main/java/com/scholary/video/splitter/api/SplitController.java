package com.scholary.video.splitter.api;

import com.scholary.video.splitter.job.JobMetadataStore;
import com.scholary.video.splitter.job.SplitJob;
import com.scholary.video.splitter.service.InvalidSubmissionException;
import com.scholary.video.splitter.service.JobStatusReader;
import com.scholary.video.splitter.service.SplitJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for video splitting.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a video and a part count (returns a job ID immediately)
 *   <li>Job status polling
 *   <li>Downloading a finished part
 * </ul>
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Split jobs", description = "Asynchronous video splitting API")
public class SplitController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SplitController.class);

  private final SplitJobService splitJobService;
  private final JobStatusReader statusReader;
  private final JobMetadataStore store;

  public SplitController(
      SplitJobService splitJobService, JobStatusReader statusReader, JobMetadataStore store) {
    this.splitJobService = splitJobService;
    this.statusReader = statusReader;
    this.store = store;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start split job",
      description = "Upload a video and queue it to be split into parts; poll the status URL")
  public ResponseEntity<AsyncJobResponse> submit(
      @RequestParam(value = "video", required = false) MultipartFile video,
      @RequestParam(value = "parts", required = false) Integer parts)
      throws IOException {
    String filename = video == null ? null : video.getOriginalFilename();
    LOGGER.info("Received upload request: filename={} parts={}", filename, parts);

    if (video == null || video.isEmpty()) {
      throw new InvalidSubmissionException("Please choose a video file to upload.");
    }

    SplitJob job;
    try (InputStream content = video.getInputStream()) {
      job = splitJobService.submit(filename, content, parts);
    }

    String statusUrl = "/api/jobs/" + job.id();
    return ResponseEntity.accepted()
        .location(URI.create(statusUrl))
        .body(new AsyncJobResponse(job.id(), statusUrl));
  }

  @GetMapping("/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of a split job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String jobId) {
    return statusReader
        .query(jobId)
        .map(view -> ResponseEntity.ok(JobStatusResponse.from(view)))
        .orElseGet(
            () -> {
              LOGGER.warn("Status requested for missing job {}", jobId);
              return ResponseEntity.status(HttpStatus.NOT_FOUND)
                  .body(JobStatusResponse.notFound(jobId));
            });
  }

  @GetMapping("/{jobId}/files/{filename}")
  @Operation(summary = "Download part", description = "Download one output file of a job")
  public ResponseEntity<Resource> download(
      @PathVariable String jobId, @PathVariable String filename) {
    if (filename.contains("/") || filename.contains("\\") || filename.startsWith(".")) {
      return ResponseEntity.badRequest().build();
    }
    if (!store.exists(jobId)
        || filename.equals(JobMetadataStore.METADATA_FILENAME)
        || filename.equals(JobMetadataStore.TEMP_FILENAME)) {
      return ResponseEntity.notFound().build();
    }

    Path file = store.jobDirectory(jobId).resolve(filename);
    if (!Files.isRegularFile(file)) {
      return ResponseEntity.notFound().build();
    }

    LOGGER.info("Downloading {} from job {}", filename, jobId);
    MediaType contentType =
        MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);
    return ResponseEntity.ok()
        .contentType(contentType)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(new FileSystemResource(file));
  }
}

package com.scholary.video.splitter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.scholary.video.splitter.job.JobStatus;
import com.scholary.video.splitter.job.SplitJob;
import com.scholary.video.splitter.service.InvalidSubmissionException;
import com.scholary.video.splitter.service.JobStatusReader;
import com.scholary.video.splitter.service.JobStatusView;
import com.scholary.video.splitter.service.SplitJobService;
import com.scholary.video.splitter.splitting.DurationUnavailableException;
import com.scholary.video.splitter.splitting.VideoSplitter;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * End-to-end flow through the application context, with the splitter replaced so no ffmpeg is
 * needed.
 */
@SpringBootTest
class VideoSplitterApplicationTests {

  @TempDir static Path dataDir;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add("splitter.upload-dir", () -> dataDir.resolve("uploads").toString());
    registry.add("splitter.output-dir", () -> dataDir.resolve("outputs").toString());
    registry.add("splitter.worker-threads", () -> "2");
  }

  @MockBean private VideoSplitter splitter;

  @Autowired private SplitJobService splitJobService;
  @Autowired private JobStatusReader statusReader;

  @Test
  void submittedJob_shouldCompleteWithOnePartPerRequestedSplit() throws Exception {
    when(splitter.split(any(), any(), eq(3)))
        .thenAnswer(
            invocation -> {
              Path outputDir = invocation.getArgument(1);
              List<String> names = List.of("trip_part1.mp4", "trip_part2.mp4", "trip_part3.mp4");
              for (String name : names) {
                Files.writeString(outputDir.resolve(name), name);
              }
              return names;
            });

    SplitJob job = splitJobService.submit("trip.mp4", new ByteArrayInputStream(new byte[8]), 3);
    List<JobStatus> observed = new ArrayList<>();
    JobStatusView view = awaitTerminal(job.id(), observed);

    assertThat(view.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(view.outputFiles())
        .containsExactly("trip_part1.mp4", "trip_part2.mp4", "trip_part3.mp4");
    assertThat(observed).doesNotContain(JobStatus.ERROR);
    assertThat(dataDir.resolve("uploads").resolve(job.id())).doesNotExist();
  }

  @Test
  void corruptSource_shouldEndInErrorAndRemoveUpload() throws Exception {
    when(splitter.split(any(), any(), eq(2)))
        .thenThrow(new DurationUnavailableException("Unable to determine duration for bad.mp4"));

    SplitJob job = splitJobService.submit("bad.mp4", new ByteArrayInputStream(new byte[8]), 2);
    JobStatusView view = awaitTerminal(job.id(), new ArrayList<>());

    assertThat(view.status()).isEqualTo(JobStatus.ERROR);
    assertThat(view.record().outputs()).isEmpty();
    assertThat(view.record().errorMessage()).isNotBlank();
    assertThat(dataDir.resolve("uploads").resolve(job.id())).doesNotExist();
  }

  @Test
  void outOfRangePartCount_shouldBeRejectedWithoutCreatingAJob() throws Exception {
    long before = countJobs();

    assertThatThrownBy(
            () -> splitJobService.submit("trip.mp4", new ByteArrayInputStream(new byte[8]), 5))
        .isInstanceOf(InvalidSubmissionException.class);

    assertThat(countJobs()).isEqualTo(before);
  }

  @Test
  void unknownJob_shouldBeNotFound() {
    assertThat(statusReader.query("0123456789abcdef0123456789abcdef")).isEmpty();
    assertThat(dataDir.resolve("outputs").resolve("0123456789abcdef0123456789abcdef"))
        .doesNotExist();
  }

  private JobStatusView awaitTerminal(String jobId, List<JobStatus> observed)
      throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    while (System.currentTimeMillis() < deadline) {
      JobStatusView view = statusReader.query(jobId).orElseThrow();
      if (observed.isEmpty() || observed.get(observed.size() - 1) != view.status()) {
        observed.add(view.status());
      }
      if (view.status().isTerminal()) {
        awaitUploadRemoved(jobId, deadline);
        return view;
      }
      Thread.sleep(20);
    }
    throw new AssertionError("Job " + jobId + " did not finish in time");
  }

  private void awaitUploadRemoved(String jobId, long deadline) throws InterruptedException {
    Path uploadDir = dataDir.resolve("uploads").resolve(jobId);
    while (Files.exists(uploadDir) && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }

  private long countJobs() throws Exception {
    try (Stream<Path> jobs = Files.list(dataDir.resolve("outputs"))) {
      return jobs.count();
    }
  }
}

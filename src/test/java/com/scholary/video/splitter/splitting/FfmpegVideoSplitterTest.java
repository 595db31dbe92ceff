package com.scholary.video.splitter.splitting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.video.splitter.config.FfmpegProperties;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FfmpegVideoSplitterTest {

  @Mock private CommandRunner commandRunner;

  @Captor private ArgumentCaptor<List<String>> commands;

  private FfmpegVideoSplitter splitter;

  private final Path source = Path.of("/uploads/job1/holiday.mp4");
  private final Path outputDir = Path.of("/outputs/job1");

  @BeforeEach
  void setUp() {
    FfmpegProperties properties = new FfmpegProperties("ffmpeg", "ffprobe", "warning", 40);
    splitter = new FfmpegVideoSplitter(commandRunner, new SplitPlanner(), properties);
  }

  @Test
  void split_shouldCutEachPartInOrderAndNameThemByIndex() throws IOException {
    when(commandRunner.run(anyList(), eq("ffprobe duration lookup"))).thenReturn(ok("9.0\n"));
    when(commandRunner.run(anyList(), startsWith("ffmpeg split part"))).thenReturn(ok(""));

    List<String> outputs = splitter.split(source, outputDir, 3);

    assertThat(outputs)
        .containsExactly("holiday_part1.mp4", "holiday_part2.mp4", "holiday_part3.mp4");

    verify(commandRunner, times(3)).run(commands.capture(), startsWith("ffmpeg split part"));

    List<List<String>> cuts = commands.getAllValues();
    assertThat(cuts.get(0))
        .containsSubsequence("-ss", "0.00", "-c", "copy", "-t", "3.00")
        .endsWith("/outputs/job1/holiday_part1.mp4");
    assertThat(cuts.get(1)).containsSubsequence("-ss", "3.00", "-t", "3.00");
    assertThat(cuts.get(2))
        .containsSubsequence("-ss", "6.00", "-c", "copy")
        .doesNotContain("-t")
        .endsWith("/outputs/job1/holiday_part3.mp4");
  }

  @Test
  void probeDuration_shouldRejectUnparseableOutput() throws IOException {
    when(commandRunner.run(anyList(), anyString())).thenReturn(ok("N/A\n"));

    assertThatThrownBy(() -> splitter.split(source, outputDir, 2))
        .isInstanceOf(DurationUnavailableException.class)
        .hasMessageContaining("Unable to determine duration");
  }

  @Test
  void probeDuration_shouldRejectNonPositiveDuration() throws IOException {
    when(commandRunner.run(anyList(), anyString())).thenReturn(ok("0.000000"));

    assertThatThrownBy(() -> splitter.probeDuration(source))
        .isInstanceOf(DurationUnavailableException.class)
        .hasMessageContaining("Invalid video duration");
  }

  @Test
  void probeDuration_shouldReportFfprobeFailureAsToolFailure() throws IOException {
    when(commandRunner.run(anyList(), anyString()))
        .thenReturn(new CommandResult(1, "", "moov atom not found", Duration.ZERO));

    assertThatThrownBy(() -> splitter.probeDuration(source))
        .isInstanceOfSatisfying(
            ExternalToolException.class,
            e -> assertThat(e.diagnostic()).isEqualTo("moov atom not found"));
  }

  @Test
  void split_shouldStopAtFirstFailedCutWithTruncatedDiagnostic() throws IOException {
    String longError = "Invalid data found when processing input ".repeat(5);
    when(commandRunner.run(anyList(), eq("ffprobe duration lookup"))).thenReturn(ok("8.0"));
    when(commandRunner.run(anyList(), eq("ffmpeg split part 1/2")))
        .thenReturn(new CommandResult(1, "", longError, Duration.ZERO));

    assertThatThrownBy(() -> splitter.split(source, outputDir, 2))
        .isInstanceOfSatisfying(
            ExternalToolException.class,
            e -> {
              assertThat(e.exitCode()).isEqualTo(1);
              assertThat(e.diagnostic()).hasSize(40).startsWith("Invalid data found");
            });
    verify(commandRunner, times(2)).run(anyList(), anyString());
  }

  @Test
  void split_shouldFallBackToExitCodeWhenStderrIsEmpty() throws IOException {
    when(commandRunner.run(anyList(), eq("ffprobe duration lookup"))).thenReturn(ok("8.0"));
    when(commandRunner.run(anyList(), eq("ffmpeg split part 1/2")))
        .thenReturn(new CommandResult(2, "", "  ", Duration.ZERO));

    assertThatThrownBy(() -> splitter.split(source, outputDir, 2))
        .isInstanceOfSatisfying(
            ExternalToolException.class,
            e -> assertThat(e.diagnostic()).contains("exited with code 2"));
  }

  private static CommandResult ok(String stdout) {
    return new CommandResult(0, stdout, "", Duration.ofMillis(5));
  }
}

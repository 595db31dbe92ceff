package com.scholary.video.splitter.splitting;

import com.scholary.video.splitter.config.FfmpegProperties;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits videos with ffprobe and ffmpeg.
 *
 * <p>The duration is probed first, then each part is cut in index order with stream copy
 * ({@code -c copy}), so no re-encoding happens and cut points snap to keyframes. Every part but
 * the last is bounded with {@code -t}; the last runs to the end of the source.
 */
@Component
public class FfmpegVideoSplitter implements VideoSplitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegVideoSplitter.class);

  private final CommandRunner commandRunner;
  private final SplitPlanner planner;
  private final FfmpegProperties properties;

  public FfmpegVideoSplitter(
      CommandRunner commandRunner, SplitPlanner planner, FfmpegProperties properties) {
    this.commandRunner = commandRunner;
    this.planner = planner;
    this.properties = properties;
  }

  @Override
  public List<String> split(Path source, Path outputDir, int parts) throws IOException {
    double duration = probeDuration(source);
    List<TimeRange> ranges = planner.planParts(duration, parts);

    String filename = source.getFileName().toString();
    int dot = filename.lastIndexOf('.');
    String stem = dot > 0 ? filename.substring(0, dot) : filename;
    String extension = dot > 0 ? filename.substring(dot) : "";

    List<String> outputs = new ArrayList<>(ranges.size());
    for (int index = 0; index < ranges.size(); index++) {
      TimeRange range = ranges.get(index);
      boolean last = index == ranges.size() - 1;
      String outputName = String.format("%s_part%d%s", stem, index + 1, extension);

      List<String> command = new ArrayList<>();
      command.add(properties.ffmpegPath());
      command.add("-y");
      command.add("-hide_banner");
      command.add("-loglevel");
      command.add(properties.logLevel());
      command.add("-i");
      command.add(source.toString());
      command.add("-ss");
      command.add(formatSeconds(range.start()));
      command.add("-c");
      command.add("copy");
      if (!last) {
        command.add("-t");
        command.add(formatSeconds(range.duration()));
      }
      command.add(outputDir.resolve(outputName).toString());

      String description = String.format("ffmpeg split part %d/%d", index + 1, parts);
      CommandResult result = commandRunner.run(command, description);
      if (!result.succeeded()) {
        throw toolFailure(description, result);
      }
      outputs.add(outputName);
    }

    LOGGER.info("Completed splitting {} into {} parts", source, parts);
    return outputs;
  }

  /**
   * Probe the duration of a media file in seconds.
   *
   * @throws DurationUnavailableException if ffprobe reports nothing usable
   * @throws ExternalToolException if ffprobe exits with an error
   */
  public double probeDuration(Path source) throws IOException {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v",
            "error",
            "-show_entries",
            "format=duration",
            "-of",
            "csv=p=0",
            source.toString());

    CommandResult result = commandRunner.run(command, "ffprobe duration lookup");
    if (!result.succeeded()) {
      throw toolFailure("ffprobe duration lookup", result);
    }

    double duration;
    try {
      duration = Double.parseDouble(result.stdout().strip());
    } catch (NumberFormatException e) {
      throw new DurationUnavailableException("Unable to determine duration for " + source, e);
    }

    if (!(duration > 0) || Double.isInfinite(duration)) {
      throw new DurationUnavailableException(
          String.format("Invalid video duration (%s) for %s", duration, source));
    }

    LOGGER.info("Duration for {}: {} seconds", source, formatSeconds(duration));
    return duration;
  }

  private ExternalToolException toolFailure(String description, CommandResult result) {
    String diagnostic = truncate(result.stderr().strip());
    if (diagnostic.isEmpty()) {
      diagnostic = String.format("%s exited with code %d", description, result.exitCode());
    }
    return new ExternalToolException(
        String.format("%s failed with exit code %d", description, result.exitCode()),
        result.exitCode(),
        diagnostic);
  }

  private String truncate(String text) {
    int max = properties.maxDiagnosticLength();
    return text.length() <= max ? text : text.substring(0, max);
  }

  static String formatSeconds(double seconds) {
    return String.format(Locale.ROOT, "%.2f", seconds);
  }
}

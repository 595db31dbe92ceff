package com.scholary.video.splitter.splitting;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Cuts a source video into contiguous parts. */
public interface VideoSplitter {

  /**
   * Split {@code source} into {@code parts} contiguous pieces written to {@code outputDir}.
   *
   * @param source the video to split
   * @param outputDir the directory receiving the parts
   * @param parts how many parts to produce
   * @return the output file names, in part order
   * @throws DurationUnavailableException if the source has no usable duration
   * @throws ExternalToolException if the cutting tool fails
   * @throws IOException if the tool cannot be started or its output cannot be read
   */
  List<String> split(Path source, Path outputDir, int parts) throws IOException;
}

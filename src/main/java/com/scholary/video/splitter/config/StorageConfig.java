package com.scholary.video.splitter.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Creates the upload and output roots at startup. */
@Configuration
public class StorageConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

  @Bean
  public StorageLayout storageLayout(SplitterProperties properties) {
    StorageLayout layout =
        new StorageLayout(
            Paths.get(properties.uploadDir()).toAbsolutePath(),
            Paths.get(properties.outputDir()).toAbsolutePath());
    createDirectory(layout.uploadRoot());
    createDirectory(layout.outputRoot());
    LOGGER.info(
        "Storage ready: uploads={}, outputs={}", layout.uploadRoot(), layout.outputRoot());
    return layout;
  }

  private static void createDirectory(Path dir) {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create directory: " + dir, e);
    }
  }

  /** Resolved roots for transient uploads and per-job outputs. */
  public record StorageLayout(Path uploadRoot, Path outputRoot) {}
}

package com.scholary.video.splitter.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for split jobs.
 *
 * <p>Controls where transient uploads and job outputs live, how many jobs may run at once, and
 * which submissions are accepted.
 */
@ConfigurationProperties(prefix = "splitter")
@Validated
public record SplitterProperties(
    @NotBlank String uploadDir,
    @NotBlank String outputDir,
    @Min(1) int workerThreads,
    @Positive int queueCapacity,
    @Min(1) int minParts,
    @Min(1) int maxParts,
    @NotEmpty List<String> allowedExtensions) {

  public SplitterProperties {
    allowedExtensions =
        allowedExtensions == null
            ? List.of()
            : allowedExtensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
    if (maxParts < minParts) {
      throw new IllegalArgumentException(
          String.format("maxParts (%d) must be >= minParts (%d)", maxParts, minParts));
    }
  }

  public boolean isAllowedExtension(String extension) {
    return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
  }

  public boolean isAllowedPartCount(int parts) {
    return parts >= minParts && parts <= maxParts;
  }
}

package com.scholary.video.splitter.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>The binaries are resolved from the PATH unless absolute paths are configured. Diagnostics
 * captured from a failed cut are truncated to {@code maxDiagnosticLength} characters before they
 * are stored in a job record.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @NotBlank String logLevel,
    @Positive int maxDiagnosticLength) {}

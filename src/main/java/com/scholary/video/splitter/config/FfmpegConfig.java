package com.scholary.video.splitter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Binds the {@code ffmpeg.*} settings used by the splitter. */
@Configuration
@EnableConfigurationProperties(FfmpegProperties.class)
public class FfmpegConfig {}

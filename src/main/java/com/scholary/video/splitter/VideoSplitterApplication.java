package com.scholary.video.splitter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoSplitterApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoSplitterApplication.class, args);
  }
}

package com.flamingo.ai.contentpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the content pipeline service. */
@SpringBootApplication
public class ContentPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContentPipelineApplication.class, args);
  }
}

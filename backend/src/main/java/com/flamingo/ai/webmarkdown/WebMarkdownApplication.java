package com.flamingo.ai.webmarkdown;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Boots the conversion beans for callers embedding the pipeline in a Spring context. */
@SpringBootApplication
public class WebMarkdownApplication {

  public static void main(String[] args) {
    SpringApplication.run(WebMarkdownApplication.class, args);
  }
}

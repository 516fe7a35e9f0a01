package com.flamingo.ai.site2rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the site2rag context enrichment service. */
@SpringBootApplication
public class Site2RagApplication {

  public static void main(String[] args) {
    SpringApplication.run(Site2RagApplication.class, args);
  }
}

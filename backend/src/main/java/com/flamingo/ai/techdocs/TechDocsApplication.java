package com.flamingo.ai.techdocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the technical-document ingestion back end. */
@SpringBootApplication
public class TechDocsApplication {

  public static void main(String[] args) {
    SpringApplication.run(TechDocsApplication.class, args);
  }
}

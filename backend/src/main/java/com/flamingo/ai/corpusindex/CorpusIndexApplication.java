package com.flamingo.ai.corpusindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Batch application that builds and maintains the semantic corpus index. */
@SpringBootApplication
public class CorpusIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(CorpusIndexApplication.class, args);
  }
}

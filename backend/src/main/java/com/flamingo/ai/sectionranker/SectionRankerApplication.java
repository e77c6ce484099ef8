package com.flamingo.ai.sectionranker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the persona-driven section ranking service. */
@SpringBootApplication
public class SectionRankerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SectionRankerApplication.class, args);
  }
}

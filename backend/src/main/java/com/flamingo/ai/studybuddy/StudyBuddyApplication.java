package com.flamingo.ai.studybuddy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Study assistant back end: streaming inference engines over REST and SSE. */
@SpringBootApplication
public class StudyBuddyApplication {

  public static void main(String[] args) {
    SpringApplication.run(StudyBuddyApplication.class, args);
  }
}

package com.scholary.transcripts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TranscriptAcquirerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TranscriptAcquirerApplication.class, args);
  }
}

package com.scholary.lecture.corrector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class LectureCorrectorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LectureCorrectorApplication.class, args);
  }
}

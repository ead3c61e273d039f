package com.example.slides;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SlideExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(SlideExtractorApplication.class, args);
  }
}

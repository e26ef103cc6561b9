package com.flamingo.ai.canlaw;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Statute hierarchy parser with a citation lookup API and legal corpus acquisition. */
@SpringBootApplication
public class CanLawApplication {

  public static void main(String[] args) {
    SpringApplication.run(CanLawApplication.class, args);
  }
}

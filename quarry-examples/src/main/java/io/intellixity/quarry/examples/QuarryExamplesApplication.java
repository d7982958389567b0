package io.intellixity.quarry.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuarryExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(QuarryExamplesApplication.class, args);
  }
}

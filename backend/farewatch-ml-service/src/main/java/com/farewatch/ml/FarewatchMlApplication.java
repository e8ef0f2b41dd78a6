package com.farewatch.ml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FarewatchMlApplication {
  public static void main(String[] args) {
    SpringApplication.run(FarewatchMlApplication.class, args);
  }
}

package com.vigil.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VigilAnomalyApplication {
  public static void main(String[] args) {
    SpringApplication.run(VigilAnomalyApplication.class, args);
  }
}

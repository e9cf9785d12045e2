package com.dqscan.quality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QualityReportApplication {

  public static void main(String[] args) {
    SpringApplication.run(QualityReportApplication.class, args);
  }
}

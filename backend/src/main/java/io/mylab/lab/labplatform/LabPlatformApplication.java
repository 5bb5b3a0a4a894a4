package io.mylab.lab.labplatform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LabPlatformApplication {

  public static void main(String[] args) {
    SpringApplication.run(LabPlatformApplication.class, args);
  }
}

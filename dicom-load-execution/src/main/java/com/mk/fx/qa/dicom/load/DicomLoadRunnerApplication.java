package com.mk.fx.qa.dicom.load;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DicomLoadRunnerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DicomLoadRunnerApplication.class, args);
  }
}

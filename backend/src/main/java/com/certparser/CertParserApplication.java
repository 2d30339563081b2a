package com.certparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CertParserApplication {

  public static void main(String[] args) {
    SpringApplication.run(CertParserApplication.class, args);
  }
}

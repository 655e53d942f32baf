package com.freelance.jobalerts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FreelanceJobAlertsApplication {

  public static void main(String[] args) {
    SpringApplication.run(FreelanceJobAlertsApplication.class, args);
  }
}

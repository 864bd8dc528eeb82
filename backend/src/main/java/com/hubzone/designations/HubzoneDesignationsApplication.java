package com.hubzone.designations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HubzoneDesignationsApplication {

  public static void main(String[] args) {
    SpringApplication.run(HubzoneDesignationsApplication.class, args);
  }
}

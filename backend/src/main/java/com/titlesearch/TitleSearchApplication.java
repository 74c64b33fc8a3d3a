package com.titlesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TitleSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(TitleSearchApplication.class, args);
  }
}

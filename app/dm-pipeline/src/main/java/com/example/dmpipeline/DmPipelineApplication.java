package com.example.dmpipeline;

import com.example.dmpipeline.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DmPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DmPipelineApplication.class, args);
  }
}

/*
 * Where: shared configuration
 * What: exposes a UTC Clock bean
 * Why: lets every component take "now" from one injectable source
 */
package com.example.dmpipeline.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}

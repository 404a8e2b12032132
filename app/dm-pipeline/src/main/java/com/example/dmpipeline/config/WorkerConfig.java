/*
 * Where: DM pipeline infrastructure configuration
 * What: provides the Sleeper used for pre-send delay and retry backoff
 * Why: tests swap it for a recording fake instead of waiting in real time
 */
package com.example.dmpipeline.config;

import com.example.dmpipeline.service.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfig {

  @Bean
  public Sleeper sleeper() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return;
      }
      Thread.sleep(duration.toMillis());
    };
  }
}

/*
 * Where: DM pipeline API
 * What: liveness with database reachability, queue depth and active keywords
 * Why: operators confirm the pipeline is configured and draining at a glance
 */
package com.example.dmpipeline.api;

import com.example.dmpipeline.config.PipelineProperties;
import com.example.dmpipeline.repository.DeliveryLogRepository;
import com.example.dmpipeline.service.DispatchQueue;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

  private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

  private final DeliveryLogRepository deliveryLogRepository;
  private final DispatchQueue dispatchQueue;
  private final PipelineProperties properties;

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    try {
      deliveryLogRepository.ping();
    } catch (DataAccessException ex) {
      logger.warn("health check database ping failed", ex);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(HealthResponse.unhealthy("database unreachable: " + ex.getMessage()));
    }
    return ResponseEntity.ok(HealthResponse.healthy(dispatchQueue.size(), properties.keywords()));
  }
}

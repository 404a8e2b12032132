package com.example.dmpipeline.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(String status, Integer queueSize, List<String> keywords, String error) {

  public static HealthResponse healthy(int queueSize, List<String> keywords) {
    return new HealthResponse("healthy", queueSize, List.copyOf(keywords), null);
  }

  public static HealthResponse unhealthy(String error) {
    return new HealthResponse("unhealthy", null, null, error);
  }
}

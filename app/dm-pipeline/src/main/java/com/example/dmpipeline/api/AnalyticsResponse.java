package com.example.dmpipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalyticsResponse(
    long totalSent,
    long totalFailed,
    double successRate,
    @JsonProperty("last_24_hours") long last24Hours,
    List<PostStat> topPosts) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record PostStat(String postId, int dmCount) {}
}

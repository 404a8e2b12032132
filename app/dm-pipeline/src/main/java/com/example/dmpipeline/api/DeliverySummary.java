package com.example.dmpipeline.api;

import com.example.dmpipeline.model.DeliveryRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliverySummary(
    String postId,
    String commentId,
    String status,
    int retryCount,
    String errorMessage,
    Instant sentAt) {

  static DeliverySummary from(DeliveryRecord record) {
    return new DeliverySummary(
        record.postId(),
        record.commentId(),
        record.status().value(),
        record.retryCount(),
        record.errorMessage(),
        record.sentAt());
  }
}

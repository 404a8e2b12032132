/*
 * Where: DM pipeline API model
 * What: delivery log rows for one recipient
 * Why: fixes the debug response shape
 */
package com.example.dmpipeline.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryHistoryResponse(String userId, List<DeliverySummary> deliveries) {
  public DeliveryHistoryResponse {
    deliveries = deliveries == null ? List.of() : List.copyOf(deliveries);
  }
}

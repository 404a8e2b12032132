/*
 * Where: DM pipeline domain model
 * What: one queued direct-message delivery
 * Why: carries everything the worker needs so it never re-reads the webhook payload
 */
package com.example.dmpipeline.model;

import java.time.Instant;

public record DispatchJob(
    String userId,
    String postId,
    String commentId,
    String messageText,
    String username,
    Instant enqueuedAt) {

  public DeliveryKey deliveryKey() {
    return new DeliveryKey(userId, postId);
  }
}

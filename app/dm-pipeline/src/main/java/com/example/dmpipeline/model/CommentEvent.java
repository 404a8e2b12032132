/*
 * Where: DM pipeline domain model
 * What: a normalized comment-change event taken from one webhook entry
 * Why: keeps matching and admission independent of the webhook body shape
 */
package com.example.dmpipeline.model;

import java.time.Instant;

public record CommentEvent(
    String commentId,
    String postId,
    String authorId,
    String authorUsername,
    String text,
    Instant receivedAt) {

  public DeliveryKey deliveryKey() {
    return new DeliveryKey(authorId, postId);
  }
}

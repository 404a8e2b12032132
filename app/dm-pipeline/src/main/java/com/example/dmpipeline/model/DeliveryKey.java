/*
 * Where: DM pipeline domain model
 * What: the (user, post) pair that identifies one delivery
 * Why: dedup, in-flight claims and the delivery log all key on the same pair
 */
package com.example.dmpipeline.model;

import java.util.Objects;

public record DeliveryKey(String userId, String postId) {

  public DeliveryKey {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(postId, "postId");
  }

  @Override
  public String toString() {
    return userId + "/" + postId;
  }
}

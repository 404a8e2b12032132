/*
 * Where: DM pipeline domain model
 * What: snapshot of one dm_delivery_log row
 * Why: shared by the debug API and repository tests
 */
package com.example.dmpipeline.model;

import java.time.Instant;

public record DeliveryRecord(
    String userId,
    String postId,
    String commentId,
    DeliveryStatus status,
    int retryCount,
    String errorMessage,
    Instant sentAt) {}

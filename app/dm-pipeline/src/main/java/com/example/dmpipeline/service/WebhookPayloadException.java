/*
 * Where: DM pipeline service layer
 * What: an inbound webhook body that cannot be parsed
 * Why: lets ingress acknowledge the sender while still logging the rejection
 */
package com.example.dmpipeline.service;

public class WebhookPayloadException extends RuntimeException {

  public WebhookPayloadException(String message) {
    super(message);
  }

  public WebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}

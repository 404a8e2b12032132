package com.example.dmpipeline.service;

public class WebhookVerificationException extends RuntimeException {

  public WebhookVerificationException(String message) {
    super(message);
  }
}

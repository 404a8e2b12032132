package com.example.dmpipeline.service.dto;

public record SendMessageRequest(Recipient recipient, Message message) {

  public static SendMessageRequest of(String recipientId, String text) {
    return new SendMessageRequest(new Recipient(recipientId), new Message(text));
  }

  public record Recipient(String id) {}

  public record Message(String text) {}
}

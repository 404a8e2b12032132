/*
 * Where: DM pipeline outbound messaging
 * What: one attempt to deliver a direct message
 * Why: the retry loop and tests stay independent of the HTTP client
 */
package com.example.dmpipeline.service;

public interface DirectMessageSender {

  /**
   * Sends {@code text} to {@code recipientId} once.
   *
   * @throws MessageDispatchException when the endpoint rejects the message or cannot be reached
   */
  void send(String recipientId, String text);
}

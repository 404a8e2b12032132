/*
 * Where: DM pipeline outbound messaging
 * What: a single failed send, classified by cause
 * Why: retry and persistence need to tell window expiry apart from transient failures
 */
package com.example.dmpipeline.service;

public class MessageDispatchException extends RuntimeException {

  private final Reason reason;
  private final int statusCode;
  private final String responseBody;

  public MessageDispatchException(Reason reason, String message) {
    this(reason, message, 0, null, null);
  }

  public MessageDispatchException(Reason reason, String message, Throwable cause) {
    this(reason, message, 0, null, cause);
  }

  public MessageDispatchException(
      Reason reason, String message, int statusCode, String responseBody, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public Reason reason() {
    return reason;
  }

  /** HTTP status of the rejected call, 0 when no response was received. */
  public int statusCode() {
    return statusCode;
  }

  public String responseBody() {
    return responseBody;
  }

  public boolean isTerminal() {
    return reason == Reason.WINDOW_EXPIRED;
  }

  public enum Reason {
    TRANSPORT,
    WINDOW_EXPIRED,
    API_ERROR,
    INVALID_RESPONSE
  }
}

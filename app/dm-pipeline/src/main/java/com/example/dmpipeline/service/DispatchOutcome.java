package com.example.dmpipeline.service;

/**
 * Result of one job's dispatch.
 *
 * @param attempts total send attempts made, at least one
 * @param lastError the final failure when {@code sent} is false
 */
public record DispatchOutcome(boolean sent, int attempts, MessageDispatchException lastError) {

  public static DispatchOutcome sent(int attempts) {
    return new DispatchOutcome(true, attempts, null);
  }

  public static DispatchOutcome failed(int attempts, MessageDispatchException lastError) {
    return new DispatchOutcome(false, attempts, lastError);
  }

  /** Retries beyond the first attempt. */
  public int retries() {
    return Math.max(attempts - 1, 0);
  }

  public String errorMessage() {
    return lastError == null ? null : lastError.getMessage();
  }
}

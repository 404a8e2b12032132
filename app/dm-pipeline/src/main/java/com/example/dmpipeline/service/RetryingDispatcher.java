/*
 * Where: DM pipeline delivery
 * What: sends one job with bounded exponential backoff between attempts
 * Why: transient platform and network failures should not lose a delivery
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.config.PipelineProperties;
import com.example.dmpipeline.model.DispatchJob;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RetryingDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(RetryingDispatcher.class);

  private final DirectMessageSender sender;
  private final PipelineProperties properties;
  private final Sleeper sleeper;
  private final DeliveryMetrics metrics;

  public DispatchOutcome dispatch(DispatchJob job) throws InterruptedException {
    final int maxAttempts = properties.maxRetries() + 1;
    MessageDispatchException lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (attempt > 1) {
        sleeper.sleep(computeBackoff(attempt - 1));
      }
      try {
        sender.send(job.userId(), job.messageText());
        metrics.recordDispatchAttempt("success");
        return DispatchOutcome.sent(attempt);
      } catch (MessageDispatchException ex) {
        lastError = ex;
        metrics.recordDispatchAttempt(ex.reason().name().toLowerCase(Locale.ROOT));
      } catch (RuntimeException ex) {
        lastError =
            new MessageDispatchException(
                MessageDispatchException.Reason.INVALID_RESPONSE,
                "unexpected dispatch failure: " + ex.getMessage(),
                ex);
        metrics.recordDispatchAttempt("unexpected");
      }
      logger.warn(
          "dm dispatch attempt failed attempt={}/{} reason={} key={}",
          attempt,
          maxAttempts,
          lastError.reason(),
          job.deliveryKey(),
          lastError);
      if (properties.skipRetryOnTerminalError() && lastError.isTerminal()) {
        logger.info("terminal dispatch error, skipping remaining retries key={}", job.deliveryKey());
        return DispatchOutcome.failed(attempt, lastError);
      }
    }
    return DispatchOutcome.failed(maxAttempts, lastError);
  }

  /** Delay before retry number {@code retry}, counted from 1. */
  @VisibleForTesting
  Duration computeBackoff(int retry) {
    final int shift = Math.min(Math.max(retry - 1, 0), 30);
    return properties.backoffBase().multipliedBy(1L << shift);
  }
}

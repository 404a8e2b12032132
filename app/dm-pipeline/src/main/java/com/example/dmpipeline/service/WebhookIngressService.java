/*
 * Where: DM pipeline webhook ingress
 * What: verification handshake and comment intake (parse, match, admit)
 * Why: the webhook sender only ever sees success so it never starts a redelivery storm
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.config.WebhookProperties;
import com.example.dmpipeline.model.CommentEvent;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookIngressService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookIngressService.class);
  private static final String MODE_SUBSCRIBE = "subscribe";

  private final WebhookProperties webhookProperties;
  private final WebhookPayloadParser parser;
  private final KeywordMatcher keywordMatcher;
  private final DeduplicationGate deduplicationGate;
  private final DeliveryMetrics metrics;

  /**
   * Returns the challenge when the subscription handshake is valid.
   *
   * @throws WebhookVerificationException on any mode or token mismatch
   */
  public String verify(String mode, String token, String challenge) {
    if (!MODE_SUBSCRIBE.equals(mode) || !tokenMatches(token)) {
      logger.warn("webhook verification rejected mode={}", mode);
      throw new WebhookVerificationException("webhook verification failed");
    }
    logger.info("webhook verified");
    return challenge == null ? "" : challenge;
  }

  /** Processes a webhook body and returns how many jobs were queued. Never throws. */
  public int ingest(String body) {
    final List<CommentEvent> events;
    try {
      events = parser.parse(body);
    } catch (WebhookPayloadException ex) {
      metrics.recordParseError();
      logger.warn("webhook payload rejected reason={}", ex.getMessage());
      return 0;
    }
    int enqueued = 0;
    for (CommentEvent event : events) {
      try {
        if (handle(event)) {
          enqueued++;
        }
      } catch (RuntimeException ex) {
        metrics.recordWebhookEvent(AdmissionResult.REJECTED.metricValue());
        logger.error(
            "comment event processing failed commentId={} key={}",
            event.commentId(),
            event.deliveryKey(),
            ex);
      }
    }
    return enqueued;
  }

  private boolean handle(CommentEvent event) {
    logger.info(
        "comment received commentId={} postId={} authorId={} username={}",
        event.commentId(),
        event.postId(),
        event.authorId(),
        event.authorUsername());
    if (!keywordMatcher.matches(event)) {
      metrics.recordWebhookEvent("unmatched");
      return false;
    }
    final AdmissionResult result = deduplicationGate.admit(event);
    metrics.recordWebhookEvent(result.metricValue());
    return result == AdmissionResult.ENQUEUED;
  }

  private boolean tokenMatches(String token) {
    if (token == null) {
      return false;
    }
    return MessageDigest.isEqual(
        token.getBytes(StandardCharsets.UTF_8),
        webhookProperties.verifyToken().getBytes(StandardCharsets.UTF_8));
  }
}

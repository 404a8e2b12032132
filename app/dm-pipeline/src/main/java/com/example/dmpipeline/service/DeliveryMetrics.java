/*
 * Where: DM pipeline service layer
 * What: webhook intake, dispatch attempt, delivery outcome and queue depth metrics
 * Why: the pipeline is asynchronous so these are the only live view of its health
 */
package com.example.dmpipeline.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry and DispatchQueue are shared Spring-managed components")
public class DeliveryMetrics {

  private static final String METRIC_WEBHOOK_EVENTS_TOTAL = "dm.webhook.events.total";
  private static final String METRIC_WEBHOOK_PARSE_ERROR_TOTAL = "dm.webhook.parse.error.total";
  private static final String METRIC_DISPATCH_ATTEMPT_TOTAL = "dm.dispatch.attempt.total";
  private static final String METRIC_DELIVERY_TOTAL = "dm.delivery.total";
  private static final String METRIC_DELIVERY_E2E_DELAY = "dm.delivery.e2e.delay";
  private static final String METRIC_QUEUE_DEPTH = "dm.queue.depth";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> webhookEventCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dispatchAttemptCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter parseErrorCounter;
  private final Timer deliveryE2eDelayTimer;

  public DeliveryMetrics(MeterRegistry meterRegistry, DispatchQueue dispatchQueue) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_DEPTH, dispatchQueue, DispatchQueue::size)
        .description("Dispatch jobs waiting for the delivery worker")
        .register(meterRegistry);
    this.parseErrorCounter =
        Counter.builder(METRIC_WEBHOOK_PARSE_ERROR_TOTAL)
            .description("Webhook bodies that could not be parsed")
            .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("Delay from comment receipt to delivery outcome")
            .register(meterRegistry);
  }

  public void recordWebhookEvent(String result) {
    increment(
        webhookEventCounters,
        METRIC_WEBHOOK_EVENTS_TOTAL,
        "Comment events by admission result",
        "result",
        result);
  }

  public void recordParseError() {
    parseErrorCounter.increment();
  }

  public void recordDispatchAttempt(String result) {
    increment(
        dispatchAttemptCounters,
        METRIC_DISPATCH_ATTEMPT_TOTAL,
        "Outbound send attempts",
        "result",
        result);
  }

  public void recordDeliveryResult(String status) {
    increment(deliveryCounters, METRIC_DELIVERY_TOTAL, "Delivery outcomes", "status", status);
  }

  public void recordDeliveryE2eDelay(Instant receivedAt, Instant completedAt) {
    if (receivedAt == null || completedAt == null || completedAt.isBefore(receivedAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(receivedAt, completedAt));
  }

  private void increment(
      ConcurrentMap<String, Counter> counters,
      String name,
      String description,
      String tagKey,
      String tagValue) {
    counters
        .computeIfAbsent(
            tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}

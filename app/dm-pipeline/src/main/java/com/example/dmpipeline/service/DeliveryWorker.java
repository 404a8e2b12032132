/*
 * Where: DM pipeline delivery
 * What: single worker thread that delays, dispatches and records each queued job in order
 * Why: one lane keeps per-job ordering and the pre-send delay simple to reason about
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.config.PipelineProperties;
import com.example.dmpipeline.model.DeliveryStatus;
import com.example.dmpipeline.model.DispatchJob;
import com.example.dmpipeline.repository.DeliveryLogRepository;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "pipeline.worker.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DeliveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryWorker.class);
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);
  private static final String MDC_USER_ID = "user_id";
  private static final String MDC_POST_ID = "post_id";
  private static final String MDC_COMMENT_ID = "comment_id";

  private final DispatchQueue dispatchQueue;
  private final RetryingDispatcher dispatcher;
  private final DeliveryLogRepository deliveryLogRepository;
  private final InFlightRegistry inFlightRegistry;
  private final PipelineProperties properties;
  private final Sleeper sleeper;
  private final DeliveryMetrics metrics;
  private final Clock clock;
  private final ThreadFactory threadFactory =
      new ThreadFactoryBuilder().setNameFormat("dm-delivery-worker-%d").setDaemon(true).build();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile boolean running;
  private volatile Thread workerThread;

  public DeliveryWorker(
      DispatchQueue dispatchQueue,
      RetryingDispatcher dispatcher,
      DeliveryLogRepository deliveryLogRepository,
      InFlightRegistry inFlightRegistry,
      PipelineProperties properties,
      Sleeper sleeper,
      DeliveryMetrics metrics,
      Clock clock) {
    this.dispatchQueue = dispatchQueue;
    this.dispatcher = dispatcher;
    this.deliveryLogRepository = deliveryLogRepository;
    this.inFlightRegistry = inFlightRegistry;
    this.properties = properties;
    this.sleeper = sleeper;
    this.metrics = metrics;
    this.clock = clock;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    running = true;
    workerThread = threadFactory.newThread(this::runLoop);
    workerThread.start();
    logger.info(
        "delivery worker started thread={} preSendDelay={} maxRetries={}",
        workerThread.getName(),
        properties.preSendDelay(),
        properties.maxRetries());
  }

  @PreDestroy
  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    running = false;
    dispatchQueue.close();
    final Thread thread = workerThread;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(properties.workerShutdownTimeout().toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      if (thread.isAlive()) {
        logger.warn("delivery worker did not stop within timeout thread={}", thread.getName());
      }
    }
    final List<DispatchJob> remaining = dispatchQueue.drainRemaining();
    for (DispatchJob job : remaining) {
      abandon(job, "queued at shutdown");
    }
    logger.info("delivery worker stopped abandoned={}", remaining.size());
  }

  public boolean isRunning() {
    final Thread thread = workerThread;
    return running && thread != null && thread.isAlive();
  }

  private void runLoop() {
    while (running && !Thread.currentThread().isInterrupted()) {
      final DispatchJob job;
      try {
        job = dispatchQueue.poll(POLL_TIMEOUT);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      }
      if (job != null) {
        processGuarded(job);
      }
    }
  }

  // the worker is the only consumer, so an unexpected failure must not end the loop
  @VisibleForTesting
  void processGuarded(DispatchJob job) {
    try {
      process(job);
    } catch (RuntimeException ex) {
      inFlightRegistry.release(job.deliveryKey());
      metrics.recordDeliveryResult("worker_error");
      logger.error(
          "dm job failed unexpectedly key={} commentId={}", job.deliveryKey(), job.commentId(), ex);
    }
  }

  /**
   * Runs one job to a persisted outcome. An interrupt abandons the job without a write and
   * leaves the thread's interrupt flag set.
   */
  @VisibleForTesting
  void process(DispatchJob job) {
    MDC.put(MDC_USER_ID, job.userId());
    MDC.put(MDC_POST_ID, job.postId());
    MDC.put(MDC_COMMENT_ID, job.commentId());
    try {
      logger.info(
          "sending dm after delay username={} delay={}", job.username(), properties.preSendDelay());
      sleeper.sleep(properties.preSendDelay());
      final DispatchOutcome outcome = dispatcher.dispatch(job);
      record(job, outcome);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      abandon(job, "interrupted");
    } finally {
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_POST_ID);
      MDC.remove(MDC_COMMENT_ID);
    }
  }

  private void record(DispatchJob job, DispatchOutcome outcome) {
    final DeliveryStatus status = outcome.sent() ? DeliveryStatus.SENT : DeliveryStatus.FAILED;
    final Instant now = Instant.now(clock);
    try {
      deliveryLogRepository.recordOutcome(
          job.userId(),
          job.postId(),
          job.commentId(),
          status,
          truncate(outcome.errorMessage()),
          outcome.retries(),
          now);
    } catch (DataAccessException ex) {
      // claim stays held so this process never re-sends a pair it failed to record
      metrics.recordDeliveryResult("persist_error");
      logger.error(
          "delivery outcome could not be recorded key={} commentId={} status={} retries={}",
          job.deliveryKey(),
          job.commentId(),
          status.value(),
          outcome.retries(),
          ex);
      return;
    }
    inFlightRegistry.release(job.deliveryKey());
    metrics.recordDeliveryResult(status.value());
    metrics.recordDeliveryE2eDelay(job.enqueuedAt(), now);
    if (outcome.sent()) {
      logger.info("dm sent username={} attempts={}", job.username(), outcome.attempts());
    } else {
      logger.warn(
          "dm failed after retries username={} attempts={} error={}",
          job.username(),
          outcome.attempts(),
          outcome.errorMessage());
    }
  }

  private void abandon(DispatchJob job, String reason) {
    inFlightRegistry.release(job.deliveryKey());
    metrics.recordDeliveryResult("abandoned");
    logger.warn(
        "dm job abandoned reason={} key={} commentId={}",
        reason,
        job.deliveryKey(),
        job.commentId());
  }

  private String truncate(String errorMessage) {
    if (errorMessage == null) {
      return null;
    }
    final int max = properties.errorMessageMaxLength();
    return errorMessage.length() <= max ? errorMessage : errorMessage.substring(0, max);
  }
}

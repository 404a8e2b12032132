/*
 * Where: DM pipeline admission
 * What: admits a matched comment to the queue at most once per (user, post)
 * Why: a commenter must never receive the same DM twice for one post
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.config.PipelineProperties;
import com.example.dmpipeline.model.CommentEvent;
import com.example.dmpipeline.model.DeliveryKey;
import com.example.dmpipeline.model.DispatchJob;
import com.example.dmpipeline.repository.DeliveryLogRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeduplicationGate {

  private static final Logger logger = LoggerFactory.getLogger(DeduplicationGate.class);
  private static final String USERNAME_PLACEHOLDER = "{username}";

  private final DeliveryLogRepository deliveryLogRepository;
  private final InFlightRegistry inFlightRegistry;
  private final DispatchQueue dispatchQueue;
  private final PipelineProperties properties;
  private final Clock clock;

  public AdmissionResult admit(CommentEvent event) {
    final DeliveryKey key = event.deliveryKey();
    // claim first so two concurrent webhook deliveries cannot both pass the exists check
    if (!inFlightRegistry.tryClaim(key)) {
      logger.info("duplicate comment dropped, delivery already in flight key={}", key);
      return AdmissionResult.DUPLICATE_IN_FLIGHT;
    }
    boolean enqueued = false;
    try {
      if (deliveryLogRepository.exists(key)) {
        logger.info("duplicate comment dropped, delivery already recorded key={}", key);
        return AdmissionResult.DUPLICATE_RECORDED;
      }
      dispatchQueue.put(toJob(event));
      enqueued = true;
      logger.info(
          "dm job queued key={} commentId={} queueSize={}",
          key,
          event.commentId(),
          dispatchQueue.size());
      return AdmissionResult.ENQUEUED;
    } catch (DataAccessException ex) {
      logger.error("delivery log lookup failed, comment dropped key={}", key, ex);
      return AdmissionResult.REJECTED;
    } catch (IllegalStateException ex) {
      logger.warn("dispatch queue closed, comment dropped key={}", key);
      return AdmissionResult.REJECTED;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("interrupted while queueing, comment dropped key={}", key);
      return AdmissionResult.REJECTED;
    } finally {
      if (!enqueued) {
        inFlightRegistry.release(key);
      }
    }
  }

  private DispatchJob toJob(CommentEvent event) {
    final String username = event.authorUsername() == null ? "" : event.authorUsername();
    return new DispatchJob(
        event.authorId(),
        event.postId(),
        event.commentId(),
        properties.messageTemplate().replace(USERNAME_PLACEHOLDER, username),
        username,
        Instant.now(clock));
  }
}

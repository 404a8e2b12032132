/*
 * Where: DM pipeline reporting
 * What: aggregate delivery counts, success rate and busiest posts
 * Why: campaign owners check how a keyword drive is performing without querying the database
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.model.DeliveryStatus;
import com.example.dmpipeline.model.PostDeliveryCount;
import com.example.dmpipeline.repository.DeliveryLogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryAnalyticsService {

  private static final Duration RECENT_WINDOW = Duration.ofHours(24);
  private static final int TOP_POST_LIMIT = 5;

  private final DeliveryLogRepository deliveryLogRepository;
  private final Clock clock;

  public Summary summarize() {
    final long sent = deliveryLogRepository.countByStatus(DeliveryStatus.SENT);
    final long failed = deliveryLogRepository.countByStatus(DeliveryStatus.FAILED);
    final long total = sent + failed;
    final double successRate = total == 0 ? 0.0d : (double) sent / total * 100.0d;
    final long recent =
        deliveryLogRepository.countWrittenSince(Instant.now(clock).minus(RECENT_WINDOW));
    return new Summary(
        sent, failed, successRate, recent, deliveryLogRepository.findTopPosts(TOP_POST_LIMIT));
  }

  public record Summary(
      long totalSent,
      long totalFailed,
      double successRate,
      long last24Hours,
      List<PostDeliveryCount> topPosts) {}
}

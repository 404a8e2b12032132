/*
 * Where: DM pipeline API
 * What: delivery totals, success rate and top posts
 * Why: read-only view over the delivery log for campaign reporting
 */
package com.example.dmpipeline.api;

import com.example.dmpipeline.service.DeliveryAnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AnalyticsController {

  private final DeliveryAnalyticsService analyticsService;

  @GetMapping("/analytics")
  public AnalyticsResponse analytics() {
    final DeliveryAnalyticsService.Summary summary = analyticsService.summarize();
    return new AnalyticsResponse(
        summary.totalSent(),
        summary.totalFailed(),
        summary.successRate(),
        summary.last24Hours(),
        summary.topPosts().stream()
            .map(post -> new AnalyticsResponse.PostStat(post.postId(), post.deliveryCount()))
            .toList());
  }
}

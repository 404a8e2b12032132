/*
 * Where: DM pipeline debug API
 * What: lists delivery log rows for a recipient
 * Why: lets support confirm whether and why a commenter got their DM
 */
package com.example.dmpipeline.api;

import com.example.dmpipeline.repository.DeliveryLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/deliveries")
@RequiredArgsConstructor
public class DeliveryDebugController {

  private final DeliveryLogRepository deliveryLogRepository;

  @GetMapping("/{userId}")
  public DeliveryHistoryResponse deliveries(@PathVariable("userId") String userId) {
    return new DeliveryHistoryResponse(
        userId,
        deliveryLogRepository.findByUserId(userId).stream().map(DeliverySummary::from).toList());
  }
}

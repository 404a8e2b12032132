/*
 * Where: DM pipeline service layer
 * What: tracks (user, post) pairs that are queued or being delivered
 * Why: makes claim-then-check atomic across concurrent webhook requests in this process
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.model.DeliveryKey;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class InFlightRegistry {

  private final Set<DeliveryKey> claimed = ConcurrentHashMap.newKeySet();

  public boolean tryClaim(DeliveryKey key) {
    return claimed.add(key);
  }

  public void release(DeliveryKey key) {
    claimed.remove(key);
  }

  public boolean isClaimed(DeliveryKey key) {
    return claimed.contains(key);
  }

  public int size() {
    return claimed.size();
  }
}

/*
 * Where: DM pipeline service layer
 * What: bounded FIFO buffer between webhook handlers and the delivery worker
 * Why: producers block when full, which is the pipeline's backpressure
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.config.PipelineProperties;
import com.example.dmpipeline.model.DispatchJob;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

@Component
public class DispatchQueue {

  // bounds how long a blocked producer takes to notice close()
  private static final long OFFER_SLICE_MS = 200;

  private final BlockingQueue<DispatchJob> jobs;
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  public DispatchQueue(PipelineProperties properties) {
    this.jobs = new ArrayBlockingQueue<>(properties.queueCapacity());
  }

  /**
   * Blocks until the job fits or the queue is closed.
   *
   * @throws IllegalStateException if the queue was closed before the job was accepted
   */
  public void put(DispatchJob job) throws InterruptedException {
    while (accepting.get()) {
      if (jobs.offer(job, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
        return;
      }
    }
    throw new IllegalStateException("dispatch queue is closed");
  }

  public DispatchJob poll(Duration timeout) throws InterruptedException {
    return jobs.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public void close() {
    accepting.set(false);
  }

  public boolean isClosed() {
    return !accepting.get();
  }

  public List<DispatchJob> drainRemaining() {
    final List<DispatchJob> remaining = new ArrayList<>();
    jobs.drainTo(remaining);
    return remaining;
  }

  public int size() {
    return jobs.size();
  }
}

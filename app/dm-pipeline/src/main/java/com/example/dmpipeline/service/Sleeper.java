/*
 * Where: DM pipeline service layer
 * What: blocking pause used by the worker delay and retry backoff
 * Why: keeps waiting behind a seam so tests observe delays without sleeping
 */
package com.example.dmpipeline.service;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;
}

/*
 * Where: DM pipeline configuration binding
 * What: keyword set, message template, delay, retry and queue settings
 * Why: read once at startup and shared read-only by every pipeline stage
 */
package com.example.dmpipeline.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    List<String> keywords,
    @NotBlank String messageTemplate,
    Duration preSendDelay,
    @PositiveOrZero @Max(20) Integer maxRetries,
    Duration backoffBase,
    @Positive Integer queueCapacity,
    boolean skipRetryOnTerminalError,
    @Positive Integer errorMessageMaxLength,
    Duration workerShutdownTimeout) {

  public PipelineProperties {
    keywords = normalizeKeywords(keywords);
    preSendDelay = preSendDelay == null ? Duration.ofMinutes(1) : preSendDelay;
    maxRetries = maxRetries == null ? 3 : maxRetries;
    backoffBase = backoffBase == null ? Duration.ofSeconds(2) : backoffBase;
    queueCapacity = queueCapacity == null ? 100 : queueCapacity;
    errorMessageMaxLength = errorMessageMaxLength == null ? 1000 : errorMessageMaxLength;
    workerShutdownTimeout =
        workerShutdownTimeout == null ? Duration.ofSeconds(5) : workerShutdownTimeout;
  }

  @AssertTrue(message = "pipeline.pre-send-delay must not be negative")
  public boolean isPreSendDelayNonNegative() {
    return !preSendDelay.isNegative();
  }

  @AssertTrue(message = "pipeline.backoff-base must not be negative")
  public boolean isBackoffBaseNonNegative() {
    return !backoffBase.isNegative();
  }

  // Lower-cased, trimmed, de-duplicated; declared order is the matching order.
  private static List<String> normalizeKeywords(List<String> raw) {
    if (raw == null) {
      return List.of();
    }
    final Set<String> normalized = new LinkedHashSet<>();
    for (String keyword : raw) {
      if (keyword == null || keyword.isBlank()) {
        continue;
      }
      normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
    }
    return Collections.unmodifiableList(new ArrayList<>(normalized));
  }
}

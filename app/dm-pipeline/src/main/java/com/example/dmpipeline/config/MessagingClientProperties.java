/*
 * Where: DM pipeline configuration binding
 * What: messaging endpoint location, business account and credential
 * Why: switch between the real Graph API and a local stub per environment
 */
package com.example.dmpipeline.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "messaging")
@Validated
public record MessagingClientProperties(
    String baseUrl,
    @NotBlank String businessId,
    @NotBlank String accessToken,
    String messagesPath,
    Duration timeout) {

  public MessagingClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://graph.facebook.com/v21.0" : baseUrl;
    messagesPath =
        messagesPath == null || messagesPath.isBlank() ? "/{businessId}/messages" : messagesPath;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
  }
}

/*
 * Where: DM pipeline configuration binding
 * What: webhook subscription verify token
 * Why: the handshake must compare against a token that never appears in code
 */
package com.example.dmpipeline.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "webhook")
@Validated
public record WebhookProperties(@NotBlank String verifyToken) {}

package com.example.dmpipeline.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class ApplicationYamlEnvironmentTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withInitializer(new ConfigDataApplicationContextInitializer())
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class)
          .withSystemProperties(
              "VERIFY_TOKEN=abc123",
              "IG_BUSINESS_ID=biz-1",
              "ACCESS_TOKEN=token-x",
              "DM_MESSAGE=Hi {username}");

  @Test
  void pipelineSettingsReadDocumentedVariables() {
    contextRunner
        .withSystemProperties(
            "KEYWORDS=dm,info",
            "DM_DELAY=30s",
            "MAX_RETRIES=5",
            "RETRY_BACKOFF_BASE=750ms",
            "DM_QUEUE_CAPACITY=7",
            "SKIP_RETRY_ON_TERMINAL_ERROR=true")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final PipelineProperties pipeline = context.getBean(PipelineProperties.class);
              assertThat(pipeline.keywords()).containsExactly("dm", "info");
              assertThat(pipeline.preSendDelay()).isEqualTo(Duration.ofSeconds(30));
              assertThat(pipeline.maxRetries()).isEqualTo(5);
              assertThat(pipeline.backoffBase()).isEqualTo(Duration.ofMillis(750));
              assertThat(pipeline.queueCapacity()).isEqualTo(7);
              assertThat(pipeline.skipRetryOnTerminalError()).isTrue();
            });
  }

  @Test
  void credentialsReadDocumentedVariables() {
    contextRunner
        .withSystemProperties("MESSAGING_BASE_URL=http://graph.local", "MESSAGING_TIMEOUT=3s")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final MessagingClientProperties messaging =
                  context.getBean(MessagingClientProperties.class);
              assertThat(messaging.baseUrl()).isEqualTo("http://graph.local");
              assertThat(messaging.businessId()).isEqualTo("biz-1");
              assertThat(messaging.accessToken()).isEqualTo("token-x");
              assertThat(messaging.timeout()).isEqualTo(Duration.ofSeconds(3));
              assertThat(context.getBean(WebhookProperties.class).verifyToken())
                  .isEqualTo("abc123");
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    PipelineProperties.class,
    WebhookProperties.class,
    MessagingClientProperties.class
  })
  static class TestConfiguration {}
}

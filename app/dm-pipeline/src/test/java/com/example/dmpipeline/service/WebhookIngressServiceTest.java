package com.example.dmpipeline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dmpipeline.config.PipelineProperties;
import com.example.dmpipeline.config.WebhookProperties;
import com.example.dmpipeline.model.CommentEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WebhookIngressServiceTest {

  private static final String PAYLOAD =
      """
      {"entry":[{"changes":[
        {"field":"comments","value":{"id":"c1","media_id":"p1","text":"please dm",
          "from":{"id":"123","username":"bob"}}},
        {"field":"comments","value":{"id":"c2","media_id":"p1","text":"nice",
          "from":{"id":"456","username":"amy"}}}
      ]}]}
      """;

  @Mock private DeduplicationGate deduplicationGate;

  private SimpleMeterRegistry registry;
  private WebhookIngressService service;

  @BeforeEach
  void setUp() {
    final PipelineProperties properties =
        new PipelineProperties(List.of("dm"), "hi", null, null, null, null, false, null, null);
    registry = new SimpleMeterRegistry();
    service =
        new WebhookIngressService(
            new WebhookProperties("abc123"),
            new WebhookPayloadParser(
                new ObjectMapper(), Clock.fixed(Instant.EPOCH, ZoneOffset.UTC)),
            new KeywordMatcher(properties),
            deduplicationGate,
            new DeliveryMetrics(registry, new DispatchQueue(properties)));
  }

  @Test
  void verifyReturnsChallengeForMatchingToken() {
    assertThat(service.verify("subscribe", "abc123", "xyz")).isEqualTo("xyz");
  }

  @Test
  void verifyRejectsWrongTokenModeOrMissingValues() {
    assertThatThrownBy(() -> service.verify("subscribe", "wrong", "xyz"))
        .isInstanceOf(WebhookVerificationException.class);
    assertThatThrownBy(() -> service.verify("unsubscribe", "abc123", "xyz"))
        .isInstanceOf(WebhookVerificationException.class);
    assertThatThrownBy(() -> service.verify(null, null, null))
        .isInstanceOf(WebhookVerificationException.class);
  }

  @Test
  void ingestAdmitsOnlyMatchingComments() {
    when(deduplicationGate.admit(any(CommentEvent.class))).thenReturn(AdmissionResult.ENQUEUED);

    final int enqueued = service.ingest(PAYLOAD);

    assertThat(enqueued).isEqualTo(1);
    verify(deduplicationGate)
        .admit(new CommentEvent("c1", "p1", "123", "bob", "please dm", Instant.EPOCH));
    assertThat(registry.get("dm.webhook.events.total").tag("result", "enqueued").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("dm.webhook.events.total").tag("result", "unmatched").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void ingestAbsorbsMalformedBody() {
    assertThat(service.ingest("{broken")).isZero();

    verify(deduplicationGate, never()).admit(any());
    assertThat(registry.get("dm.webhook.parse.error.total").counter().count()).isEqualTo(1.0d);
  }

  @Test
  void ingestContinuesAfterUnexpectedGateFailure() {
    when(deduplicationGate.admit(any(CommentEvent.class)))
        .thenThrow(new IllegalArgumentException("boom"));

    assertThat(service.ingest(PAYLOAD)).isZero();
    assertThat(registry.get("dm.webhook.events.total").tag("result", "rejected").counter().count())
        .isEqualTo(1.0d);
  }
}

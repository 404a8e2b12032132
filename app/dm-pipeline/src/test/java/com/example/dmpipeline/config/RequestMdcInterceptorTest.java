package com.example.dmpipeline.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundWebhookRequest() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/webhook");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addHeader("X-Hub-Signature-256", "sha256=abc");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/webhook");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("webhook_signed")).isEqualTo("true");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("webhook_signed")).isNull();
  }

  @Test
  void recordsHandshakeModeButNotToken() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/webhook");
    request.setParameter("hub.mode", "subscribe");
    request.setParameter("hub.verify_token", "abc123");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("hub_mode")).isEqualTo("subscribe");
    assertThat(MDC.getCopyOfContextMap()).doesNotContainValue("abc123");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("hub_mode")).isNull();
  }

  @Test
  void generatesRequestIdAndFallsBackToRemoteAddress() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
    request.setRemoteAddr("192.168.0.5");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.168.0.5");
    assertThat(MDC.get("webhook_signed")).isNull();
  }
}

/*
 * Where: DM pipeline outbound messaging
 * What: posts a direct message to the Graph messages endpoint and classifies the result
 * Why: status and error codes are the only signal the retry loop gets from the platform
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.config.MessagingClientProperties;
import com.example.dmpipeline.service.dto.SendMessageRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class GraphApiDirectMessageSender implements DirectMessageSender {

  private static final Logger logger = LoggerFactory.getLogger(GraphApiDirectMessageSender.class);

  // Graph "outside of allowed window" error
  static final int WINDOW_EXPIRED_CODE = 10;
  static final int WINDOW_EXPIRED_SUBCODE = 2018278;

  private final RestClient messagingRestClient;
  private final MessagingClientProperties properties;
  private final ObjectMapper objectMapper;

  public GraphApiDirectMessageSender(
      RestClient messagingRestClient,
      MessagingClientProperties properties,
      ObjectMapper objectMapper) {
    this.messagingRestClient = messagingRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void send(String recipientId, String text) {
    try {
      messagingRestClient
          .post()
          .uri(properties.messagesPath(), properties.businessId())
          .contentType(MediaType.APPLICATION_JSON)
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.accessToken())
          .body(SendMessageRequest.of(recipientId, text))
          .retrieve()
          .onStatus(
              status -> !status.is2xxSuccessful(),
              (request, response) -> {
                throw toDispatchException(response);
              })
          .toBodilessEntity();
    } catch (MessageDispatchException ex) {
      throw ex;
    } catch (ResourceAccessException ex) {
      throw new MessageDispatchException(
          MessageDispatchException.Reason.TRANSPORT,
          "messaging endpoint unreachable: " + ex.getMessage(),
          ex);
    } catch (RestClientException ex) {
      throw new MessageDispatchException(
          MessageDispatchException.Reason.INVALID_RESPONSE,
          "messaging endpoint returned an unreadable response: " + ex.getMessage(),
          ex);
    }
  }

  private MessageDispatchException toDispatchException(ClientHttpResponse response)
      throws IOException {
    final HttpStatusCode status = response.getStatusCode();
    final String body = readBody(response);
    return classify(status.value(), body);
  }

  @VisibleForTesting
  MessageDispatchException classify(int statusCode, String body) {
    if (isWindowExpired(body)) {
      logger.warn("messaging window expired status={}", statusCode);
      return new MessageDispatchException(
          MessageDispatchException.Reason.WINDOW_EXPIRED,
          "messaging window expired (status " + statusCode + "): " + body,
          statusCode,
          body,
          null);
    }
    return new MessageDispatchException(
        MessageDispatchException.Reason.API_ERROR,
        "messaging api error (status " + statusCode + "): " + body,
        statusCode,
        body,
        null);
  }

  private boolean isWindowExpired(String body) {
    if (body == null || body.isBlank()) {
      return false;
    }
    try {
      final JsonNode error = objectMapper.readTree(body).path("error");
      return error.path("code").asInt(-1) == WINDOW_EXPIRED_CODE
          && error.path("error_subcode").asInt(-1) == WINDOW_EXPIRED_SUBCODE;
    } catch (JsonProcessingException ex) {
      // non-json error bodies are still reported as generic api errors
      return false;
    }
  }

  private String readBody(ClientHttpResponse response) throws IOException {
    try (InputStream body = response.getBody()) {
      return new String(body.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}

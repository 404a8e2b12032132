/*
 * Where: DM pipeline webhook ingress
 * What: turns a comment webhook body into CommentEvents
 * Why: one tolerant parser for every body shape the platform sends
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.model.CommentEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebhookPayloadParser {

  private static final Logger logger = LoggerFactory.getLogger(WebhookPayloadParser.class);
  private static final String FIELD_COMMENTS = "comments";

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public List<CommentEvent> parse(String body) {
    if (body == null || body.isBlank()) {
      throw new WebhookPayloadException("webhook body is empty");
    }
    final JsonNode root = readTree(body);
    if (root == null || !root.isObject()) {
      throw new WebhookPayloadException("webhook body must be a json object");
    }
    final Instant receivedAt = Instant.now(clock);
    final List<CommentEvent> events = new ArrayList<>();
    for (JsonNode entry : arrayOf(root, "entry")) {
      for (JsonNode change : arrayOf(entry, "changes")) {
        if (!FIELD_COMMENTS.equals(textOf(change, "field"))) {
          continue;
        }
        toCommentEvent(change.path("value"), receivedAt).ifPresent(events::add);
      }
    }
    return events;
  }

  private JsonNode readTree(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new WebhookPayloadException("webhook body is not valid json", ex);
    }
  }

  private Optional<CommentEvent> toCommentEvent(JsonNode value, Instant receivedAt) {
    final String commentId = textOf(value, "id");
    final String postId = textOf(value, "media_id");
    final JsonNode from = value.path("from");
    final String authorId = textOf(from, "id");
    if (isBlank(commentId) || isBlank(postId) || isBlank(authorId)) {
      // a single incomplete change must not discard its siblings
      logger.warn(
          "comment change skipped because required ids are missing commentId={} postId={} authorId={}",
          commentId,
          postId,
          authorId);
      return Optional.empty();
    }
    final String text = textOf(value, "text");
    return Optional.of(
        new CommentEvent(
            commentId,
            postId,
            authorId,
            textOf(from, "username"),
            text == null ? "" : text,
            receivedAt));
  }

  private Iterable<JsonNode> arrayOf(JsonNode node, String field) {
    final JsonNode array = node.path(field);
    return array.isArray() ? array : List.of();
  }

  private String textOf(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    return value.asText();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}

/*
 * Where: DM pipeline service layer
 * What: case-insensitive substring match of comment text against the keyword set
 * Why: only comments asking for the DM should reach the queue
 */
package com.example.dmpipeline.service;

import com.example.dmpipeline.config.PipelineProperties;
import com.example.dmpipeline.model.CommentEvent;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class KeywordMatcher {

  private final PipelineProperties properties;

  public boolean matches(CommentEvent event) {
    return firstMatch(event).isPresent();
  }

  // keywords are already lower-cased at bind time; first one in declared order wins
  public Optional<String> firstMatch(CommentEvent event) {
    if (event == null || event.text() == null || event.text().isEmpty()) {
      return Optional.empty();
    }
    final String text = event.text().toLowerCase(Locale.ROOT);
    for (String keyword : properties.keywords()) {
      if (text.contains(keyword)) {
        return Optional.of(keyword);
      }
    }
    return Optional.empty();
  }
}

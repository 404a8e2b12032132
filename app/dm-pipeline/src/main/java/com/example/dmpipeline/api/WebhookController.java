/*
 * Where: DM pipeline webhook API
 * What: subscription handshake and comment event intake endpoints
 * Why: the platform calls these two routes and nothing else
 */
package com.example.dmpipeline.api;

import com.example.dmpipeline.service.WebhookIngressService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
public class WebhookController {

  static final String ACKNOWLEDGEMENT = "EVENT_RECEIVED";

  private final WebhookIngressService ingressService;

  @GetMapping
  public ResponseEntity<String> verify(
      @RequestParam(name = "hub.mode", required = false) String mode,
      @RequestParam(name = "hub.verify_token", required = false) String token,
      @RequestParam(name = "hub.challenge", required = false) String challenge) {
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_PLAIN)
        .body(ingressService.verify(mode, token, challenge));
  }

  // acknowledged regardless of content; the ingress service absorbs every failure
  @PostMapping
  public ResponseEntity<String> receive(@RequestBody(required = false) String body) {
    ingressService.ingest(body);
    return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(ACKNOWLEDGEMENT);
  }
}

/*
 * Where: DM pipeline web layer
 * What: request-scoped MDC keys for webhook and API calls
 * Why: webhook acknowledgements are instant, so logs are the only trace of what a call did
 */
package com.example.dmpipeline.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final String HEADER_REQUEST_ID = "X-Request-Id";
  private static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
  private static final String HEADER_HUB_SIGNATURE = "X-Hub-Signature-256";
  private static final String PARAM_HUB_MODE = "hub.mode";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> values = resolve(request);
    values.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, Set.copyOf(values.keySet()));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof Set<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private Map<String, String> resolve(HttpServletRequest request) {
    final Map<String, String> values = new LinkedHashMap<>();
    putIfPresent(values, "request_id", resolveRequestId(request));
    putIfPresent(values, "http_method", request.getMethod());
    putIfPresent(values, "http_path", request.getRequestURI());
    putIfPresent(values, "client_ip", resolveClientIp(request));
    // handshake mode only; the verify token and challenge stay out of the logs
    putIfPresent(values, "hub_mode", request.getParameter(PARAM_HUB_MODE));
    if (request.getHeader(HEADER_HUB_SIGNATURE) != null) {
      values.put("webhook_signed", "true");
    }
    return values;
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(HEADER_REQUEST_ID);
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  // first hop of X-Forwarded-For, else the socket peer
  private String resolveClientIp(HttpServletRequest request) {
    final String forwardedFor = request.getHeader(HEADER_FORWARDED_FOR);
    if (forwardedFor == null || forwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwardedFor.split(",", 2)[0].trim();
  }

  private void putIfPresent(Map<String, String> values, String key, String value) {
    if (value != null && !value.isBlank()) {
      values.put(key, value);
    }
  }
}

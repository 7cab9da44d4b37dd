package com.ospicorp.tagsync.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log with timing. Each request gets an id (taken from {@code X-Request-Id} when the
 * caller sends one) that is echoed back and put in the MDC, so pipeline log lines for one upload
 * can be told apart.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
  public static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String MDC_KEY = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (!StringUtils.hasText(requestId)) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(MDC_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} failed: {}", request.getMethod(), describe(request),
          ex.getMessage(), ex);
      throw ex;
    } finally {
      log.info("HTTP {} {} -> {} ({} ms)", request.getMethod(), describe(request),
          response.getStatus(), System.currentTimeMillis() - startTime);
      MDC.remove(MDC_KEY);
    }
  }

  /** Request URI with its query string and the client address. */
  static String describe(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String queryString = request.getQueryString();
    if (queryString != null && !queryString.isBlank()) {
      uri = uri + "?" + queryString;
    }
    String client = request.getHeader("X-Forwarded-For");
    client = client != null && !client.isBlank()
        ? client.split(",")[0].trim()
        : request.getRemoteAddr();
    return uri + " from " + client;
  }
}

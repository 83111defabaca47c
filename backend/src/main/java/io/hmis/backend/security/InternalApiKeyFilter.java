package io.hmis.backend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Guards the {@code /internal/} endpoints with a shared API key. With no key configured every
 * internal request is refused.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 5)
public class InternalApiKeyFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(InternalApiKeyFilter.class);

  static final String API_KEY_HEADER = "X-API-KEY";
  static final String INTERNAL_PREFIX = "/internal/";

  private final byte[] expectedApiKey;
  private final ObjectMapper objectMapper;

  public InternalApiKeyFilter(
      @Value("${hmis.internal.api-key:}") String expectedApiKey, ObjectMapper objectMapper) {
    this.expectedApiKey = expectedApiKey.getBytes(StandardCharsets.UTF_8);
    this.objectMapper = objectMapper;
    if (expectedApiKey.isBlank()) {
      log.warn("hmis.internal.api-key is not set; /internal/ endpoints will reject every request");
    }
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String apiKey = request.getHeader(API_KEY_HEADER);

    if (isValid(apiKey)) {
      filterChain.doFilter(request, response);
      return;
    }
    log.warn("Rejected internal request: path={}", request.getRequestURI());
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, "Invalid API key");
    problem.setTitle("Unauthorized");
    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), problem);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith(INTERNAL_PREFIX);
  }

  private boolean isValid(String apiKey) {
    if (apiKey == null || expectedApiKey.length == 0) {
      return false;
    }
    return MessageDigest.isEqual(expectedApiKey, apiKey.getBytes(StandardCharsets.UTF_8));
  }
}

package io.hmis.backend.multitenancy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.hmis.backend.exception.TenantNotProvisionedException;
import io.hmis.backend.exception.TenantResolutionException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a {@link TenantContext} to every request before it reaches a handler. Public routes are
 * bound to {@link TenantContext#none()}; tenant routes whose tenant cannot be resolved, or whose
 * tenant is not provisioned, are rejected here. The binding is removed when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  private final TenantResolver tenantResolver;
  private final TenantRepository tenantRepository;
  private final ObjectMapper objectMapper;
  private final Cache<String, String> schemaCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(1)).build();

  public TenantFilter(
      TenantResolver tenantResolver, TenantRepository tenantRepository, ObjectMapper objectMapper) {
    this.tenantResolver = tenantResolver;
    this.tenantRepository = tenantRepository;
    this.objectMapper = objectMapper;
  }

  /** Evicts the cached schema name for the given tenant. */
  public void evictSchema(String tenantId) {
    schemaCache.invalidate(tenantId);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (tenantResolver.isPublic(request.getRequestURI())) {
      runBound(TenantContext.none(), request, response, filterChain);
      return;
    }

    Optional<String> tenantId = tenantResolver.resolve(request);
    if (tenantId.isEmpty()) {
      log.debug("Tenant resolution failed: path={}", request.getRequestURI());
      writeProblem(response, new TenantResolutionException(tenantResolver.headerName()));
      return;
    }

    String schema = resolveSchema(tenantId.get());
    if (schema == null) {
      log.warn("Unknown tenant: tenantId={}, path={}", tenantId.get(), request.getRequestURI());
      writeProblem(response, new TenantNotProvisionedException(tenantId.get()));
      return;
    }

    runBound(TenantContext.of(tenantId.get(), schema), request, response, filterChain);
  }

  private void runBound(
      TenantContext context,
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    request.setAttribute(TenantContext.REQUEST_ATTRIBUTE, context);
    try {
      filterChain.doFilter(request, response);
    } finally {
      request.removeAttribute(TenantContext.REQUEST_ATTRIBUTE);
    }
  }

  private String resolveSchema(String tenantId) {
    // Caffeine's cache.get(key, loader) throws NPE if loader returns null.
    // Use getIfPresent + manual put so unknown tenants are not cached.
    String cached = schemaCache.getIfPresent(tenantId);
    if (cached != null) {
      return cached;
    }
    String schema = tenantRepository.findActiveSchema(tenantId).orElse(null);
    if (schema != null) {
      schemaCache.put(tenantId, schema);
    }
    return schema;
  }

  private void writeProblem(HttpServletResponse response, ErrorResponseException ex)
      throws IOException {
    response.setStatus(ex.getStatusCode().value());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), ex.getBody());
  }
}

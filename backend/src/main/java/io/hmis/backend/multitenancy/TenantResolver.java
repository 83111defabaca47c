package io.hmis.backend.multitenancy;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Extracts a tenant identifier from an inbound request: the explicit header first, then (when
 * enabled) the leftmost label of a host with at least three labels, unless that label is reserved.
 * Identifiers are returned in lower case whichever way they arrive.
 */
@Component
public class TenantResolver {

  private final TenancyProperties properties;

  public TenantResolver(TenancyProperties properties) {
    this.properties = properties;
  }

  public Optional<String> resolve(HttpServletRequest request) {
    return resolve(request.getHeader(properties.header()), request.getServerName());
  }

  public Optional<String> resolve(String headerValue, String host) {
    if (headerValue != null && !headerValue.isBlank()) {
      return Optional.of(headerValue.trim().toLowerCase(Locale.ROOT));
    }
    if (properties.subdomainEnabled()) {
      return fromHost(host);
    }
    return Optional.empty();
  }

  public boolean isPublic(String path) {
    if (path == null) {
      return false;
    }
    return properties.publicPaths().stream().anyMatch(path::startsWith);
  }

  public String headerName() {
    return properties.header();
  }

  private Optional<String> fromHost(String host) {
    if (host == null || host.isBlank()) {
      return Optional.empty();
    }
    String hostname = stripPort(host.trim()).toLowerCase(Locale.ROOT);
    String[] labels = hostname.split("\\.");
    if (labels.length < 3) {
      return Optional.empty();
    }
    String candidate = labels[0];
    if (candidate.isEmpty() || properties.reservedLabels().contains(candidate)) {
      return Optional.empty();
    }
    return Optional.of(candidate);
  }

  private static String stripPort(String host) {
    int colon = host.indexOf(':');
    return colon >= 0 ? host.substring(0, colon) : host;
  }
}

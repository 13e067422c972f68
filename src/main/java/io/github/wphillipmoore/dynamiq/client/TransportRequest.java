package io.github.wphillipmoore.dynamiq.client;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable description of a single HTTP exchange with the Dynamiq server.
 *
 * @param method the HTTP method (GET, PUT, PATCH or DELETE)
 * @param url fully-qualified URL including the API version prefix
 * @param body the request body, or {@code null} for none
 * @param headers the request headers, never null, unmodifiable
 * @param timeout request timeout, or {@code null} for no timeout
 */
public record TransportRequest(
    String method,
    String url,
    @Nullable String body,
    Map<String, String> headers,
    @Nullable Duration timeout) {

  /** Validates non-null fields and defensively copies headers. */
  public TransportRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(url, "url");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }
}

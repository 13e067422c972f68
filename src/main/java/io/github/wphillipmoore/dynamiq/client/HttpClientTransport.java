package io.github.wphillipmoore.dynamiq.client;

import io.github.wphillipmoore.dynamiq.client.exception.DynamiqConnectionException;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqTimeoutException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * JDK {@link HttpClient}-based implementation of {@link DynamiqTransport}.
 *
 * <p>With persistent connections enabled a single {@link HttpClient} is built up front and its
 * keep-alive connection pool is reused by every request. With persistent connections disabled a
 * fresh client is built for each request, so no connection outlives the exchange that opened it.
 * The transport performs no retries.
 *
 * <p>Disabling persistent connections has a cost: an {@link HttpClient} cannot be closed on JDK 17,
 * so each per-request client keeps its selector thread and idle connection until it is garbage
 * collected. A shared client cannot opt out of keep-alive instead, because {@code Connection} is a
 * restricted header. Prefer persistent connections unless the server requires otherwise.
 */
public final class HttpClientTransport implements DynamiqTransport {

  /** Default connect timeout (2 seconds). */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

  private final Supplier<HttpClient> clientFactory;
  private final boolean persistentConnections;

  /** Creates a transport with the default connect timeout and persistent connections. */
  public HttpClientTransport() {
    this(DEFAULT_CONNECT_TIMEOUT, true);
  }

  /**
   * Creates a transport.
   *
   * @param connectTimeout the timeout for establishing a connection
   * @param persistentConnections whether connections are kept alive and reused across requests
   */
  public HttpClientTransport(Duration connectTimeout, boolean persistentConnections) {
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Supplier<HttpClient> factory =
        () ->
            HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    this.persistentConnections = persistentConnections;
    if (persistentConnections) {
      HttpClient shared = factory.get();
      this.clientFactory = () -> shared;
    } else {
      this.clientFactory = factory;
    }
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    Objects.requireNonNull(client, "client");
    this.clientFactory = () -> client;
    this.persistentConnections = true;
  }

  /** Returns whether connections are reused across requests. */
  public boolean isPersistentConnections() {
    return persistentConnections;
  }

  @Override
  public TransportResponse send(TransportRequest request) {
    HttpRequest.BodyPublisher publisher =
        request.body() != null
            ? HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8)
            : HttpRequest.BodyPublishers.noBody();

    HttpRequest.Builder requestBuilder =
        HttpRequest.newBuilder().uri(URI.create(request.url())).method(request.method(), publisher);

    request.headers().forEach(requestBuilder::header);

    if (request.timeout() != null) {
      requestBuilder.timeout(request.timeout());
    }

    HttpClient activeClient = clientFactory.get();
    HttpResponse<String> response;
    try {
      response =
          activeClient.send(
              requestBuilder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (HttpTimeoutException e) {
      throw new DynamiqTimeoutException(
          "HTTP request timed out", request.url(), request.timeout(), e);
    } catch (IOException e) {
      throw new DynamiqConnectionException("HTTP request failed", request.url(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DynamiqConnectionException("HTTP request interrupted", request.url(), e);
    }

    String body = response.body() != null ? response.body() : "";
    return new TransportResponse(response.statusCode(), body, flattenHeaders(response.headers()));
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }
}

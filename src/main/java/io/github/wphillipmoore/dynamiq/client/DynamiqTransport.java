package io.github.wphillipmoore.dynamiq.client;

/**
 * Transport interface for Dynamiq REST API HTTP communication.
 *
 * <p>An implementation performs exactly one HTTP exchange per call and never retries on its own;
 * retrying is left to the client's {@link
 * io.github.wphillipmoore.dynamiq.client.retry.RetryPolicy}.
 * Implementations should throw {@link
 * io.github.wphillipmoore.dynamiq.client.exception.DynamiqConnectionException} for network or
 * connection failures and {@link
 * io.github.wphillipmoore.dynamiq.client.exception.DynamiqTimeoutException} when a timeout elapses.
 * Any HTTP status, including error statuses, is returned as a {@link TransportResponse}.
 */
public interface DynamiqTransport {

  /**
   * Sends a request to the Dynamiq REST API.
   *
   * @param request the request to send
   * @return the transport response
   */
  TransportResponse send(TransportRequest request);
}

package io.github.wphillipmoore.dynamiq.client.exception;

import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the transport times out connecting to, or waiting for, the Dynamiq server.
 *
 * <p>The {@code timeout} may be {@code null} if the request carried no explicit timeout.
 */
public final class DynamiqTimeoutException extends DynamiqException {

  private static final long serialVersionUID = 1L;

  private final String url;
  private final @Nullable Duration timeout;

  /**
   * Creates a timeout exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param timeout the timeout that elapsed, or {@code null} if unknown
   * @param cause the underlying cause
   */
  public DynamiqTimeoutException(
      String message, String url, @Nullable Duration timeout, Throwable cause) {
    super(ErrorKind.TIMEOUT_FAILURE, message, cause);
    this.url = Objects.requireNonNull(url, "url");
    this.timeout = timeout;
  }

  /** Returns the URL that was being accessed when the timeout occurred. */
  public String getUrl() {
    return url;
  }

  /**
   * Returns the timeout that elapsed, or {@code null} if the request had none.
   *
   * @return the timeout, or {@code null}
   */
  public @Nullable Duration getTimeout() {
    return timeout;
  }
}

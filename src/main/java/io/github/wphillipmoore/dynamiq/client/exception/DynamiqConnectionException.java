package io.github.wphillipmoore.dynamiq.client.exception;

import java.util.Objects;

/** Thrown when a network or connection failure occurs communicating with the Dynamiq server. */
public final class DynamiqConnectionException extends DynamiqException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a connection exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   */
  public DynamiqConnectionException(String message, String url) {
    super(ErrorKind.CONNECTION_FAILURE, message);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a connection exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public DynamiqConnectionException(String message, String url, Throwable cause) {
    super(ErrorKind.CONNECTION_FAILURE, message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}

package io.github.wphillipmoore.dynamiq.client.exception;

import java.util.Objects;

/**
 * Base for failures signalled by an HTTP status code from the Dynamiq server.
 *
 * <p>Carries the URL, the last observed status code and the raw response body for diagnostics.
 */
public abstract sealed class DynamiqStatusException extends DynamiqException
    permits DynamiqAlreadyExistsException,
        DynamiqNotFoundException,
        DynamiqInvalidArgumentException,
        DynamiqRequestException {

  private static final long serialVersionUID = 1L;

  private final String url;
  private final int statusCode;
  private final String responseText;

  /**
   * Creates a status exception.
   *
   * @param kind the failure classification
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code of the last response
   * @param responseText the raw response body, never null
   */
  protected DynamiqStatusException(
      ErrorKind kind, String message, String url, int statusCode, String responseText) {
    super(kind, message);
    this.url = Objects.requireNonNull(url, "url");
    this.statusCode = statusCode;
    this.responseText = Objects.requireNonNull(responseText, "responseText");
  }

  /** Returns the URL that was being accessed. */
  public String getUrl() {
    return url;
  }

  /** Returns the HTTP status code of the last response. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the raw body of the last response. */
  public String getResponseText() {
    return responseText;
  }
}

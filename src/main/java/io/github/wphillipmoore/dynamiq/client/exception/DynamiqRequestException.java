package io.github.wphillipmoore.dynamiq.client.exception;

/**
 * Thrown when a call ends on a status that is neither its success status nor one the operation
 * recognizes. This includes exhausting retries on a non-terminal status.
 */
public sealed class DynamiqRequestException extends DynamiqStatusException
    permits DynamiqDeliveryException, DynamiqAcknowledgementException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a request exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code of the last response
   * @param responseText the raw response body
   */
  public DynamiqRequestException(String message, String url, int statusCode, String responseText) {
    this(ErrorKind.REQUEST_FAILED, message, url, statusCode, responseText);
  }

  DynamiqRequestException(
      ErrorKind kind, String message, String url, int statusCode, String responseText) {
    super(kind, message, url, statusCode, responseText);
  }
}

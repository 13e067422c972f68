package io.github.wphillipmoore.dynamiq.client.exception;

/** Thrown when the server rejects the arguments of a receive call (HTTP 422). */
public final class DynamiqInvalidArgumentException extends DynamiqStatusException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code of the response
   * @param responseText the raw response body
   */
  public DynamiqInvalidArgumentException(
      String message, String url, int statusCode, String responseText) {
    super(ErrorKind.INVALID_ARGUMENT, message, url, statusCode, responseText);
  }
}

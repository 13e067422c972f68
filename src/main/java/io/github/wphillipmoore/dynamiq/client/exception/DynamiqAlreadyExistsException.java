package io.github.wphillipmoore.dynamiq.client.exception;

/** Thrown when a create call finds the topic or queue already present (HTTP 422). */
public final class DynamiqAlreadyExistsException extends DynamiqStatusException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code of the response
   * @param responseText the raw response body
   */
  public DynamiqAlreadyExistsException(
      String message, String url, int statusCode, String responseText) {
    super(ErrorKind.ALREADY_EXISTS, message, url, statusCode, responseText);
  }
}

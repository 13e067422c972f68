package io.github.wphillipmoore.dynamiq.client.exception;

/** Thrown when the addressed topic, queue or message does not exist (HTTP 404). */
public final class DynamiqNotFoundException extends DynamiqStatusException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code of the response
   * @param responseText the raw response body
   */
  public DynamiqNotFoundException(String message, String url, int statusCode, String responseText) {
    super(ErrorKind.NOT_FOUND, message, url, statusCode, responseText);
  }
}

package io.github.wphillipmoore.dynamiq.client.exception;

/** Thrown when acknowledging one or more messages does not reach the success status. */
public final class DynamiqAcknowledgementException extends DynamiqRequestException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an acknowledgement exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code of the last response
   * @param responseText the raw response body
   */
  public DynamiqAcknowledgementException(
      String message, String url, int statusCode, String responseText) {
    super(ErrorKind.ACKNOWLEDGEMENT_FAILURE, message, url, statusCode, responseText);
  }
}

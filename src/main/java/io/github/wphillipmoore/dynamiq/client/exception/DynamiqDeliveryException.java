package io.github.wphillipmoore.dynamiq.client.exception;

/** Thrown when a publish or enqueue does not reach its success status. */
public final class DynamiqDeliveryException extends DynamiqRequestException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a delivery exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code of the last response
   * @param responseText the raw response body
   */
  public DynamiqDeliveryException(String message, String url, int statusCode, String responseText) {
    super(ErrorKind.DELIVERY_FAILURE, message, url, statusCode, responseText);
  }
}

package io.github.wphillipmoore.dynamiq.client.exception;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the Dynamiq server answers with its success status but the body is malformed or does
 * not have the expected shape.
 *
 * <p>The {@code responseText} may be {@code null} if the response body was not available.
 */
public final class DynamiqResponseException extends DynamiqException {

  private static final long serialVersionUID = 1L;

  private final @Nullable String responseText;

  /**
   * Creates a response exception.
   *
   * @param message description of the failure
   * @param responseText the raw response text, or {@code null} if unavailable
   */
  public DynamiqResponseException(String message, @Nullable String responseText) {
    super(ErrorKind.MALFORMED_RESPONSE, message);
    this.responseText = responseText;
  }

  /**
   * Creates a response exception with a cause.
   *
   * @param message description of the failure
   * @param responseText the raw response text, or {@code null} if unavailable
   * @param cause the underlying cause
   */
  public DynamiqResponseException(
      String message, @Nullable String responseText, Throwable cause) {
    super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    this.responseText = responseText;
  }

  /**
   * Returns the raw response text, or {@code null} if the response body was not available.
   *
   * @return the response text, or {@code null}
   */
  public @Nullable String getResponseText() {
    return responseText;
  }
}

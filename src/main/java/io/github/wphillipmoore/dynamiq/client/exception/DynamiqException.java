package io.github.wphillipmoore.dynamiq.client.exception;

import java.util.Objects;

/**
 * Base exception for all Dynamiq client errors.
 *
 * <p>This is an unchecked exception hierarchy. All Dynamiq errors extend this sealed class and
 * report their {@link ErrorKind}.
 */
public abstract sealed class DynamiqException extends RuntimeException
    permits DynamiqConnectionException,
        DynamiqTimeoutException,
        DynamiqResponseException,
        DynamiqStatusException {

  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  /** Creates an exception with the given kind and message. */
  protected DynamiqException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /** Creates an exception with the given kind, message and cause. */
  protected DynamiqException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /** Returns the classification of this failure. */
  public ErrorKind getKind() {
    return kind;
  }
}

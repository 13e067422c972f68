package io.github.wphillipmoore.dynamiq.client.exception;

/**
 * Classification of a failed Dynamiq call.
 *
 * <p>Every {@link DynamiqException} carries exactly one kind, so callers may either catch a
 * specific exception type or switch on {@link DynamiqException#getKind()}.
 */
public enum ErrorKind {
  /** The transport could not reach the server. */
  CONNECTION_FAILURE,
  /** The transport gave up waiting for the server. */
  TIMEOUT_FAILURE,
  /** A create call found the topic or queue already present. */
  ALREADY_EXISTS,
  /** The addressed topic, queue or message is unknown to the server. */
  NOT_FOUND,
  /** The server rejected the request arguments (for example a bad batch size). */
  INVALID_ARGUMENT,
  /** The server answered with a status the operation does not recognize. */
  REQUEST_FAILED,
  /** A publish or enqueue did not reach its success status. */
  DELIVERY_FAILURE,
  /** An acknowledgement did not reach its success status. */
  ACKNOWLEDGEMENT_FAILURE,
  /** The server answered with the success status but a body that could not be decoded. */
  MALFORMED_RESPONSE
}

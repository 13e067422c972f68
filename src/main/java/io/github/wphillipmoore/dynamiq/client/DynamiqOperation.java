package io.github.wphillipmoore.dynamiq.client;

import io.github.wphillipmoore.dynamiq.client.exception.ErrorKind;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Request policy for each Dynamiq REST operation.
 *
 * <p>Each constant fixes the HTTP method, the terminal statuses that stop the retry loop, the
 * status that counts as success, the statuses with a dedicated {@link ErrorKind}, and the kind
 * used for every other status.
 */
public enum DynamiqOperation {
  CREATE_TOPIC(
      "create topic",
      "PUT",
      201,
      Set.of(201, 422),
      Map.of(422, ErrorKind.ALREADY_EXISTS),
      ErrorKind.REQUEST_FAILED),
  CREATE_QUEUE(
      "create queue",
      "PUT",
      201,
      Set.of(201, 422),
      Map.of(422, ErrorKind.ALREADY_EXISTS),
      ErrorKind.REQUEST_FAILED),
  DELETE_TOPIC(
      "delete topic",
      "DELETE",
      200,
      Set.of(200, 404),
      Map.of(404, ErrorKind.NOT_FOUND),
      ErrorKind.REQUEST_FAILED),
  DELETE_QUEUE(
      "delete queue",
      "DELETE",
      200,
      Set.of(200, 404),
      Map.of(404, ErrorKind.NOT_FOUND),
      ErrorKind.REQUEST_FAILED),
  SUBSCRIBE_QUEUE(
      "subscribe queue to topic",
      "PUT",
      200,
      Set.of(200, 422),
      Map.of(),
      ErrorKind.REQUEST_FAILED),
  CONFIGURE_QUEUE("configure queue", "PATCH", 200, Set.of(200), Map.of(), ErrorKind.REQUEST_FAILED),
  PUBLISH("publish to topic", "PUT", 200, Set.of(200), Map.of(), ErrorKind.DELIVERY_FAILURE),
  ENQUEUE("enqueue to queue", "PUT", 200, Set.of(200), Map.of(), ErrorKind.DELIVERY_FAILURE),
  ACKNOWLEDGE(
      "acknowledge message",
      "DELETE",
      200,
      Set.of(200),
      Map.of(),
      ErrorKind.ACKNOWLEDGEMENT_FAILURE),
  ACKNOWLEDGE_MANY(
      "acknowledge messages",
      "DELETE",
      200,
      Set.of(200),
      Map.of(),
      ErrorKind.ACKNOWLEDGEMENT_FAILURE),
  RECEIVE(
      "receive messages",
      "GET",
      200,
      Set.of(200, 404, 422),
      Map.of(404, ErrorKind.NOT_FOUND, 422, ErrorKind.INVALID_ARGUMENT),
      ErrorKind.REQUEST_FAILED),
  QUEUE_DETAILS(
      "read queue details",
      "GET",
      200,
      Set.of(200, 404),
      Map.of(404, ErrorKind.NOT_FOUND),
      ErrorKind.REQUEST_FAILED),
  KNOWN_QUEUES("list known queues", "GET", 200, Set.of(200), Map.of(), ErrorKind.REQUEST_FAILED),
  KNOWN_TOPICS("list known topics", "GET", 200, Set.of(200), Map.of(), ErrorKind.REQUEST_FAILED);

  private final String description;
  private final String method;
  private final int successStatus;
  private final Set<Integer> terminalStatuses;
  private final Map<Integer, ErrorKind> statusKinds;
  private final ErrorKind fallbackKind;

  DynamiqOperation(
      String description,
      String method,
      int successStatus,
      Set<Integer> terminalStatuses,
      Map<Integer, ErrorKind> statusKinds,
      ErrorKind fallbackKind) {
    this.description = description;
    this.method = method;
    this.successStatus = successStatus;
    this.terminalStatuses = terminalStatuses;
    this.statusKinds = statusKinds;
    this.fallbackKind = fallbackKind;
  }

  /** Returns a short human-readable description, used in error messages. */
  public String description() {
    return description;
  }

  /** Returns the HTTP method. */
  public String method() {
    return method;
  }

  /** Returns the status code that means success. */
  public int successStatus() {
    return successStatus;
  }

  /** Returns the unmodifiable set of statuses that stop the retry loop. */
  public Set<Integer> terminalStatuses() {
    return terminalStatuses;
  }

  /** Returns whether {@code statusCode} stops the retry loop. */
  public boolean isTerminal(int statusCode) {
    return terminalStatuses.contains(statusCode);
  }

  /**
   * Classifies the last response of a call.
   *
   * @param response the last response obtained by the retry loop
   * @return a success result, or a failure carrying the matching {@link ErrorKind}
   */
  public ClassifiedResponse classify(TransportResponse response) {
    Objects.requireNonNull(response, "response");
    if (response.statusCode() == successStatus) {
      return ClassifiedResponse.success(this, response);
    }
    ErrorKind kind = statusKinds.getOrDefault(response.statusCode(), fallbackKind);
    return ClassifiedResponse.failure(this, response, kind);
  }
}

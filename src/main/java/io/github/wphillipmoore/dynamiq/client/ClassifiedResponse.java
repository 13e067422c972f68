package io.github.wphillipmoore.dynamiq.client;

import io.github.wphillipmoore.dynamiq.client.exception.ErrorKind;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of classifying the last response of a call: either success, or the {@link ErrorKind}
 * the response maps to.
 *
 * @param operation the operation that produced the response
 * @param response the last response obtained
 * @param errorKind the failure classification, or {@code null} on success
 */
public record ClassifiedResponse(
    DynamiqOperation operation, TransportResponse response, @Nullable ErrorKind errorKind) {

  /** Validates non-null fields. */
  public ClassifiedResponse {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(response, "response");
  }

  static ClassifiedResponse success(DynamiqOperation operation, TransportResponse response) {
    return new ClassifiedResponse(operation, response, null);
  }

  static ClassifiedResponse failure(
      DynamiqOperation operation, TransportResponse response, ErrorKind errorKind) {
    return new ClassifiedResponse(
        operation, response, Objects.requireNonNull(errorKind, "errorKind"));
  }

  /** Returns {@code true} when the response carried the operation's success status. */
  public boolean isSuccess() {
    return errorKind == null;
  }
}

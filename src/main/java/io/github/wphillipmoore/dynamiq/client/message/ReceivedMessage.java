package io.github.wphillipmoore.dynamiq.client.message;

import java.io.Serializable;
import java.util.Objects;

/**
 * A message delivered by {@code receive}.
 *
 * <p>The {@code id} is what {@code acknowledge} expects once the message has been processed.
 *
 * @param id the server-assigned message id
 * @param body the message body as stored by the server
 */
public record ReceivedMessage(String id, String body) implements Serializable {

  /** Validates non-null fields. */
  public ReceivedMessage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(body, "body");
  }
}

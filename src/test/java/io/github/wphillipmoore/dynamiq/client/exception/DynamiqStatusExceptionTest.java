package io.github.wphillipmoore.dynamiq.client.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DynamiqStatusExceptionTest {

  private static final String URL = "http://example.io:9999/v1/queues/q";

  @Test
  void alreadyExistsCarriesStatusAndBody() {
    DynamiqAlreadyExistsException ex =
        new DynamiqAlreadyExistsException("exists", URL, 422, "{\"error\":\"exists\"}");

    assertThat(ex.getKind()).isEqualTo(ErrorKind.ALREADY_EXISTS);
    assertThat(ex.getUrl()).isEqualTo(URL);
    assertThat(ex.getStatusCode()).isEqualTo(422);
    assertThat(ex.getResponseText()).isEqualTo("{\"error\":\"exists\"}");
    assertThat(ex).isInstanceOf(DynamiqStatusException.class);
  }

  @Test
  void eachStatusExceptionReportsItsKind() {
    assertThat(new DynamiqNotFoundException("m", URL, 404, "").getKind())
        .isEqualTo(ErrorKind.NOT_FOUND);
    assertThat(new DynamiqInvalidArgumentException("m", URL, 422, "").getKind())
        .isEqualTo(ErrorKind.INVALID_ARGUMENT);
    assertThat(new DynamiqRequestException("m", URL, 500, "").getKind())
        .isEqualTo(ErrorKind.REQUEST_FAILED);
  }

  @Test
  void deliveryAndAcknowledgementAreRequestExceptions() {
    DynamiqDeliveryException delivery = new DynamiqDeliveryException("m", URL, 503, "busy");
    DynamiqAcknowledgementException ack =
        new DynamiqAcknowledgementException("m", URL, 404, "gone");

    assertThat(delivery).isInstanceOf(DynamiqRequestException.class);
    assertThat(delivery.getKind()).isEqualTo(ErrorKind.DELIVERY_FAILURE);
    assertThat(ack).isInstanceOf(DynamiqRequestException.class);
    assertThat(ack.getKind()).isEqualTo(ErrorKind.ACKNOWLEDGEMENT_FAILURE);
    assertThat(ack.getResponseText()).isEqualTo("gone");
  }

  @Test
  void nullUrlThrows() {
    assertThatThrownBy(() -> new DynamiqNotFoundException("m", null, 404, ""))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("url");
  }

  @Test
  void nullResponseTextThrows() {
    assertThatThrownBy(() -> new DynamiqRequestException("m", URL, 500, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("responseText");
  }
}

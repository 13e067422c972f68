package io.github.wphillipmoore.dynamiq.client.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DynamiqResponseExceptionTest {

  @Test
  void constructWithoutCause() {
    DynamiqResponseException ex = new DynamiqResponseException("fail", "{\"queues\":");
    assertThat(ex.getMessage()).isEqualTo("fail");
    assertThat(ex.getResponseText()).isEqualTo("{\"queues\":");
    assertThat(ex.getKind()).isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    assertThat(ex.getCause()).isNull();
  }

  @Test
  void constructWithCause() {
    Throwable cause = new RuntimeException("root");
    DynamiqResponseException ex = new DynamiqResponseException("fail", null, cause);
    assertThat(ex.getResponseText()).isNull();
    assertThat(ex.getCause()).isSameAs(cause);
  }
}

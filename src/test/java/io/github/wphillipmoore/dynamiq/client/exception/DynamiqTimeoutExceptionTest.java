package io.github.wphillipmoore.dynamiq.client.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DynamiqTimeoutExceptionTest {

  @Test
  void exposesUrlTimeoutAndKind() {
    Throwable cause = new HttpTimeoutException("request timed out");
    DynamiqTimeoutException ex =
        new DynamiqTimeoutException(
            "HTTP request timed out", "http://example.io/v1", Duration.ofMillis(100), cause);

    assertThat(ex.getUrl()).isEqualTo("http://example.io/v1");
    assertThat(ex.getTimeout()).isEqualTo(Duration.ofMillis(100));
    assertThat(ex.getKind()).isEqualTo(ErrorKind.TIMEOUT_FAILURE);
    assertThat(ex.getCause()).isSameAs(cause);
  }

  @Test
  void nullTimeoutAccepted() {
    DynamiqTimeoutException ex =
        new DynamiqTimeoutException("timed out", "http://example.io", null, new RuntimeException());

    assertThat(ex.getTimeout()).isNull();
  }
}

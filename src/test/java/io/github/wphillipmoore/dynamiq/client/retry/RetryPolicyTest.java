package io.github.wphillipmoore.dynamiq.client.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.dynamiq.client.TransportResponse;
import io.github.wphillipmoore.dynamiq.client.exception.DynamiqConnectionException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private static final IntPredicate OK_OR_MISSING = Set.of(200, 404)::contains;

  /** Replays the given statuses in order and counts invocations. */
  private static final class ScriptedAttempt implements Supplier<TransportResponse> {
    private final Deque<Integer> statuses;
    private final AtomicInteger calls = new AtomicInteger();

    ScriptedAttempt(Integer... statuses) {
      this.statuses = new ArrayDeque<>(List.of(statuses));
    }

    @Override
    public TransportResponse get() {
      calls.incrementAndGet();
      int status = statuses.size() > 1 ? statuses.pop() : statuses.peek();
      return new TransportResponse(status, "attempt " + calls.get());
    }

    int calls() {
      return calls.get();
    }
  }

  @Test
  void defaultRetryCountIsTwo() {
    assertThat(new RetryPolicy().getRetryCount()).isEqualTo(2);
  }

  @Test
  void negativeRetryCountThrows() {
    assertThatThrownBy(() -> new RetryPolicy(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("retryCount must be >= 0");
  }

  @Test
  void terminalFirstResponseIsNotRetried() {
    ScriptedAttempt attempt = new ScriptedAttempt(200);

    TransportResponse response = new RetryPolicy(2).execute(OK_OR_MISSING, attempt);

    assertThat(attempt.calls()).isEqualTo(1);
    assertThat(response.statusCode()).isEqualTo(200);
  }

  @Test
  void nonTerminalTwiceThenTerminalInvokesThreeTimes() {
    ScriptedAttempt attempt = new ScriptedAttempt(500, 503, 404);

    TransportResponse response = new RetryPolicy(2).execute(OK_OR_MISSING, attempt);

    assertThat(attempt.calls()).isEqualTo(3);
    assertThat(response.statusCode()).isEqualTo(404);
    assertThat(response.body()).isEqualTo("attempt 3");
  }

  @Test
  void exhaustedRetriesReturnLastNonTerminalResponse() {
    ScriptedAttempt attempt = new ScriptedAttempt(500);

    TransportResponse response = new RetryPolicy(3).execute(OK_OR_MISSING, attempt);

    assertThat(attempt.calls()).isEqualTo(4);
    assertThat(response.statusCode()).isEqualTo(500);
    assertThat(response.body()).isEqualTo("attempt 4");
  }

  @Test
  void zeroRetryCountMakesSingleAttempt() {
    ScriptedAttempt attempt = new ScriptedAttempt(500, 200);

    TransportResponse response = new RetryPolicy(0).execute(OK_OR_MISSING, attempt);

    assertThat(attempt.calls()).isEqualTo(1);
    assertThat(response.statusCode()).isEqualTo(500);
  }

  @Test
  void transportExceptionPropagatesWithoutRetry() {
    AtomicInteger calls = new AtomicInteger();
    Supplier<TransportResponse> failing =
        () -> {
          calls.incrementAndGet();
          throw new DynamiqConnectionException("HTTP request failed", "http://example.io");
        };

    assertThatThrownBy(() -> new RetryPolicy(2).execute(OK_OR_MISSING, failing))
        .isInstanceOf(DynamiqConnectionException.class);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void exceptionOnRetryPropagates() {
    AtomicInteger calls = new AtomicInteger();
    Supplier<TransportResponse> flaky =
        () -> {
          if (calls.incrementAndGet() == 1) {
            return new TransportResponse(502, "bad gateway");
          }
          throw new DynamiqConnectionException("HTTP request failed", "http://example.io");
        };

    assertThatThrownBy(() -> new RetryPolicy(2).execute(OK_OR_MISSING, flaky))
        .isInstanceOf(DynamiqConnectionException.class);
    assertThat(calls.get()).isEqualTo(2);
  }

  @Test
  void nullArgumentsThrowNullPointerException() {
    RetryPolicy policy = new RetryPolicy();

    assertThatThrownBy(() -> policy.execute(null, () -> new TransportResponse(200, "")))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("terminal");
    assertThatThrownBy(() -> policy.execute(OK_OR_MISSING, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("attempt");
  }
}

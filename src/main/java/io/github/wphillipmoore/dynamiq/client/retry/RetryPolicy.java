package io.github.wphillipmoore.dynamiq.client.retry;

import io.github.wphillipmoore.dynamiq.client.TransportResponse;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded application-level retry around a single transport exchange.
 *
 * <p>The attempt is invoked once, then again while the returned status code is not terminal and
 * retries remain. The last response is returned whether or not its status is terminal; deciding
 * what a non-terminal final status means is left to the caller.
 *
 * <p>Exceptions thrown by the attempt are not retried and propagate from the first attempt that
 * throws.
 */
public final class RetryPolicy {

  /** Default number of retries after the first attempt (2). */
  public static final int DEFAULT_RETRY_COUNT = 2;

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

  private final int retryCount;

  /**
   * Creates a retry policy.
   *
   * @param retryCount the number of attempts allowed after the first (must be &gt;= 0)
   * @throws IllegalArgumentException if {@code retryCount} is negative
   */
  public RetryPolicy(int retryCount) {
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    this.retryCount = retryCount;
  }

  /** Creates a retry policy with {@link #DEFAULT_RETRY_COUNT}. */
  public RetryPolicy() {
    this(DEFAULT_RETRY_COUNT);
  }

  /** Returns the number of attempts allowed after the first. */
  public int getRetryCount() {
    return retryCount;
  }

  /**
   * Runs the attempt until it yields a terminal status or retries are exhausted.
   *
   * @param terminal accepts the status codes that stop the loop
   * @param attempt performs one exchange
   * @return the last response obtained
   */
  public TransportResponse execute(IntPredicate terminal, Supplier<TransportResponse> attempt) {
    Objects.requireNonNull(terminal, "terminal");
    Objects.requireNonNull(attempt, "attempt");

    int retriesLeft = retryCount;
    TransportResponse response = attempt.get();
    while (!terminal.test(response.statusCode()) && retriesLeft > 0) {
      retriesLeft--;
      LOGGER.warn(
          "Retrying after non-terminal status {} ({} retries left)",
          response.statusCode(),
          retriesLeft);
      response = attempt.get();
    }
    if (!terminal.test(response.statusCode())) {
      LOGGER.warn(
          "Giving up after {} attempts, last status {}", retryCount + 1, response.statusCode());
    }
    return response;
  }
}

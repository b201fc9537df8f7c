package com.example.retryable.core;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Thrown when an operation kept failing with a retryable failure until the attempt budget was
 * spent.
 *
 * <p>The cause is the failure thrown by the last attempt, the same object the operation threw.
 * Only thrown after at least one retry; when no retry happened the original failure propagates
 * unmodified instead.
 *
 * <pre>{@code
 * try {
 *   fetcher.call(url, Retry.CallOptions.none().withMaxAttempts(3));
 * } catch (RetryExhaustedException e) {
 *   log.warn("gave up after {} retries", e.getRetryCount());
 *   e.causeAs(IOException.class).ifPresent(this::reportIo);
 * }
 * }</pre>
 */
public class RetryExhaustedException extends RuntimeException {

  private final int retryCount;

  public RetryExhaustedException(final int retryCount, final Throwable cause) {
    super("Gave up after " + retryCount + " retries: " + cause, cause);
    if (retryCount < 1) throw new IllegalArgumentException("retryCount must be >= 1");
    this.retryCount = retryCount;
  }

  /**
   * Returns the number of retries performed, not counting the original attempt.
   *
   * @return retry count
   */
  public int getRetryCount() {
    return retryCount;
  }

  /**
   * Returns the last failure if it is an instance of the given type.
   *
   * @param type expected failure type
   * @param <X> failure type
   * @return the cast cause, or empty if it is of another type
   */
  public <X extends Throwable> Optional<X> causeAs(final Class<X> type) {
    return Optional.ofNullable(getCause()).filter(type::isInstance).map(type::cast);
  }

  /**
   * Reads the retry count from any throwable surfaced by a retrying call.
   *
   * @param failure throwable caught from a retrying call
   * @return the retry count, or empty if the failure carries none
   */
  public static OptionalInt retryCountOf(final Throwable failure) {
    return failure instanceof RetryExhaustedException exhausted
        ? OptionalInt.of(exhausted.getRetryCount())
        : OptionalInt.empty();
  }
}

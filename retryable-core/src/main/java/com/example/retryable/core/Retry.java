package com.example.retryable.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Retry engine behind {@link Retryable}.
 *
 * <p>Holds the configuration types, the per-failure decision and the blocking retry loop. The
 * decision and delay helpers are public so that other adapters (see {@code ReactiveRetry}) apply
 * exactly the same rules.
 *
 * <h2>Configuration Sources</h2>
 *
 * <ul>
 *   <li>{@link Policy} is fixed when the operation is wrapped: attempt count, exclusion set and a
 *       default predicate.
 *   <li>{@link CallOptions} are supplied per call: attempt count, initial delay, backoff factor and
 *       predicate. They are never forwarded to the wrapped operation.
 * </ul>
 *
 * <p>The attempt count resolves call-time first, then wrap-time, then {@link
 * #DEFAULT_MAX_ATTEMPTS}. The predicate resolves call-time first, then wrap-time, then "always
 * retry".
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * String body = Retry.call(
 *     () -> httpClient.fetch(url),
 *     Retry.Policy.defaults().withNoRetry(FileNotFoundException.class),
 *     Retry.CallOptions.none()
 *         .withMaxAttempts(5)
 *         .withDelay(Duration.ofMillis(200))
 *         .withBackoff(2.0));
 * }</pre>
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  /** Total attempts (including the first) when neither the call nor the policy sets a count. */
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** Delay before the first retry when the call does not set one. */
  public static final Duration DEFAULT_DELAY = Duration.ZERO;

  /** Delay multiplier when the call does not set one; 1.0 keeps the delay constant. */
  public static final double DEFAULT_BACKOFF = 1.0;

  private Retry() {}

  /**
   * Operation taking one argument that can throw a checked exception.
   *
   * @param <A> argument type
   * @param <R> result type
   * @param <E> checked exception type
   */
  @FunctionalInterface
  public interface Operation<A, R, E extends Exception> {
    R apply(A argument) throws E;
  }

  /**
   * Supplier that can throw a checked exception.
   *
   * @param <T> result type
   * @param <E> checked exception type
   */
  @FunctionalInterface
  public interface ExceptionSupplier<T, E extends Exception> {
    T get() throws E;
  }

  /** Blocks the calling thread between attempts. Replaced in tests to record delays. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration delay) throws InterruptedException;

    static Sleeper threadSleep() {
      return delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos());
    }
  }

  /** Outcome of evaluating one failed attempt. */
  public enum Decision {
    /** Wait and invoke the operation again. */
    RETRY,
    /** Excluded or rejected by the predicate: surface the original failure as is. */
    REJECT,
    /** Retryable but the attempt budget is spent. */
    EXHAUSTED
  }

  /**
   * Custom retry decision for a caught failure.
   *
   * <h3>Combining Predicates</h3>
   *
   * <pre>{@code
   * var onTimeouts = Retry.RetryPredicate.custom(e -> e instanceof TimeoutException);
   * var onUnavailable = Retry.RetryPredicate.custom(e -> e.getMessage().contains("503"));
   * var either = onTimeouts.or(onUnavailable);
   * }</pre>
   */
  @FunctionalInterface
  public interface RetryPredicate {
    /**
     * Decides whether the failure should be retried.
     *
     * @param failure the failure thrown by the last attempt
     * @return true to retry, false to surface the failure immediately
     */
    boolean shouldRetry(Throwable failure);

    /**
     * Returns the predicate used when none is configured.
     *
     * @return predicate accepting every failure
     */
    static RetryPredicate always() {
      return failure -> true;
    }

    /**
     * Creates a predicate from a plain {@link Predicate}.
     *
     * @param predicate the predicate to adapt
     * @return retry predicate
     */
    static RetryPredicate custom(final Predicate<Throwable> predicate) {
      return predicate::test;
    }

    default RetryPredicate and(final RetryPredicate other) {
      return failure -> this.shouldRetry(failure) && other.shouldRetry(failure);
    }

    default RetryPredicate or(final RetryPredicate other) {
      return failure -> this.shouldRetry(failure) || other.shouldRetry(failure);
    }

    default RetryPredicate negate() {
      return failure -> !this.shouldRetry(failure);
    }
  }

  /**
   * Wrap-time retry configuration.
   *
   * @param maxAttempts total attempts including the first, or null when unset; 0 and 1 both mean a
   *     single attempt
   * @param noRetry failure types that are never retried, subclasses included
   * @param predicate default retry decision, or null for "always retry"
   */
  public record Policy(
      Integer maxAttempts, Set<Class<? extends Throwable>> noRetry, RetryPredicate predicate) {

    public Policy {
      if (maxAttempts != null && maxAttempts < 0)
        throw new IllegalArgumentException("maxAttempts must be >= 0");
      noRetry = noRetry == null ? Set.of() : Set.copyOf(noRetry);
    }

    /**
     * Creates a policy with nothing set.
     *
     * @return empty policy
     */
    public static Policy defaults() {
      return new Policy(null, Set.of(), null);
    }

    /**
     * Creates a policy with only the attempt count set.
     *
     * @param maxAttempts total attempts including the first
     * @return policy
     */
    public static Policy attempts(final int maxAttempts) {
      return new Policy(maxAttempts, Set.of(), null);
    }

    public Policy withMaxAttempts(final int maxAttempts) {
      return new Policy(maxAttempts, noRetry, predicate);
    }

    @SafeVarargs
    public final Policy withNoRetry(final Class<? extends Throwable>... types) {
      final var merged = new HashSet<>(noRetry);
      merged.addAll(Arrays.asList(types));
      return new Policy(maxAttempts, merged, predicate);
    }

    public Policy withPredicate(final RetryPredicate predicate) {
      return new Policy(maxAttempts, noRetry, predicate);
    }

    /**
     * Checks the failure against the exclusion set.
     *
     * @param failure the failure to classify
     * @return true if the failure is an instance of an excluded type
     */
    public boolean excludes(final Throwable failure) {
      for (final var type : noRetry) if (type.isInstance(failure)) return true;
      return false;
    }
  }

  /**
   * Per-call retry overrides.
   *
   * @param maxAttempts total attempts for this call, or null to use the policy
   * @param delay wait before the first retry, must be >= 0
   * @param backoff multiplier applied to the delay after each retry, must be >= 1.0
   * @param predicate retry decision for this call, or null to use the policy
   */
  public record CallOptions(
      Integer maxAttempts, Duration delay, double backoff, RetryPredicate predicate) {

    public CallOptions {
      if (maxAttempts != null && maxAttempts < 0)
        throw new IllegalArgumentException("maxAttempts must be >= 0");
      if (delay == null) delay = DEFAULT_DELAY;
      if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
      if (Double.isNaN(backoff) || backoff < 1.0)
        throw new IllegalArgumentException("backoff must be >= 1.0");
    }

    /**
     * Returns options overriding nothing.
     *
     * @return empty call options
     */
    public static CallOptions none() {
      return new CallOptions(null, DEFAULT_DELAY, DEFAULT_BACKOFF, null);
    }

    public CallOptions withMaxAttempts(final int maxAttempts) {
      return new CallOptions(maxAttempts, delay, backoff, predicate);
    }

    public CallOptions withDelay(final Duration delay) {
      return new CallOptions(maxAttempts, delay, backoff, predicate);
    }

    public CallOptions withBackoff(final double backoff) {
      return new CallOptions(maxAttempts, delay, backoff, predicate);
    }

    public CallOptions withPredicate(final RetryPredicate predicate) {
      return new CallOptions(maxAttempts, delay, backoff, predicate);
    }
  }

  /**
   * Resolves the attempt budget: call-time, then wrap-time, then {@link #DEFAULT_MAX_ATTEMPTS}.
   *
   * @param policy wrap-time configuration
   * @param options call-time configuration
   * @return total attempts, at least 1
   */
  public static int maxAttempts(final Policy policy, final CallOptions options) {
    final int resolved =
        Optional.ofNullable(options.maxAttempts())
            .or(() -> Optional.ofNullable(policy.maxAttempts()))
            .orElse(DEFAULT_MAX_ATTEMPTS);
    return Math.max(1, resolved);
  }

  /**
   * Resolves the predicate: call-time, then wrap-time, then {@link RetryPredicate#always()}.
   *
   * @param policy wrap-time configuration
   * @param options call-time configuration
   * @return predicate to consult for non-excluded failures
   */
  public static RetryPredicate predicate(final Policy policy, final CallOptions options) {
    return Optional.ofNullable(options.predicate())
        .or(() -> Optional.ofNullable(policy.predicate()))
        .orElseGet(RetryPredicate::always);
  }

  /**
   * Evaluates one failed attempt.
   *
   * <p>The exclusion set is checked first and the predicate is not consulted for excluded failures.
   * Exceptions thrown by the predicate propagate to the caller.
   *
   * @param failure the failure thrown by the attempt
   * @param attempt attempt number (1-based)
   * @param maxAttempts resolved attempt budget
   * @param policy wrap-time configuration
   * @param predicate resolved predicate
   * @return decision for this failure
   */
  public static Decision decide(
      final Throwable failure,
      final long attempt,
      final int maxAttempts,
      final Policy policy,
      final RetryPredicate predicate) {
    if (policy.excludes(failure)) {
      LOGGER.log(DEBUG, "{0} is in the no-retry list", failure.getClass().getName());
      return Decision.REJECT;
    }
    if (!predicate.shouldRetry(failure)) {
      LOGGER.log(DEBUG, "Retry predicate rejected {0}", failure.getClass().getName());
      return Decision.REJECT;
    }
    return attempt >= maxAttempts ? Decision.EXHAUSTED : Decision.RETRY;
  }

  /**
   * Calculates the wait before a retry: {@code delay * backoff^(retry - 1)}.
   *
   * @param options call-time configuration
   * @param retry retry number (1-based, the original call is not a retry)
   * @return delay before that retry
   */
  public static Duration delayForRetry(final CallOptions options, final long retry) {
    if (retry < 1 || options.delay().isZero()) return Duration.ZERO;
    final var delay = options.delay();
    final double initial = delay.getSeconds() * 1e9 + delay.getNano();
    final double nanos = initial * Math.pow(options.backoff(), retry - 1);
    return Duration.ofNanos((long) Math.min(nanos, Long.MAX_VALUE));
  }

  /**
   * Builds the failure surfaced once the budget is spent.
   *
   * @param failure the last failure
   * @param retries retries performed
   * @return the original failure when no retry happened, otherwise a carrier with the count
   */
  public static Throwable exhausted(final Throwable failure, final long retries) {
    return retries > 0 ? new RetryExhaustedException((int) retries, failure) : failure;
  }

  /**
   * Invokes a supplier with retries.
   *
   * @param supplier operation to execute
   * @param policy wrap-time configuration
   * @param options call-time configuration
   * @param <T> result type
   * @param <E> checked exception type
   * @return the first successful result
   * @throws E if the failure is excluded, rejected, or the budget allowed no retry
   * @throws RetryExhaustedException if retries were performed and all of them failed
   */
  public static <T, E extends Exception> T call(
      final ExceptionSupplier<T, E> supplier, final Policy policy, final CallOptions options)
      throws E {
    return Retry.<Void, T, E>execute(ignored -> supplier.get(), null, policy, options);
  }

  /**
   * Invokes an operation with retries, forwarding the argument untouched on every attempt.
   *
   * @param operation operation to execute
   * @param argument argument passed to each attempt
   * @param policy wrap-time configuration
   * @param options call-time configuration
   * @param <A> argument type
   * @param <R> result type
   * @param <E> checked exception type
   * @return the first successful result
   * @throws E if the failure is excluded, rejected, or the budget allowed no retry
   * @throws RetryExhaustedException if retries were performed and all of them failed
   */
  public static <A, R, E extends Exception> R execute(
      final Operation<A, R, E> operation,
      final A argument,
      final Policy policy,
      final CallOptions options)
      throws E {
    return execute(operation, argument, policy, options, Sleeper.threadSleep());
  }

  static <A, R, E extends Exception> R execute(
      final Operation<A, R, E> operation,
      final A argument,
      final Policy policy,
      final CallOptions options,
      final Sleeper sleeper)
      throws E {
    final var maxAttempts = maxAttempts(policy, options);
    final var predicate = predicate(policy, options);
    var attempt = 0;

    while (true) {
      attempt++;
      LOGGER.log(DEBUG, "Executing attempt {0} of {1}", attempt, maxAttempts);
      try {
        return operation.apply(argument);
      } catch (final Exception failure) {
        final var decision = decide(failure, attempt, maxAttempts, policy, predicate);

        if (decision == Decision.REJECT) throw failure;

        if (decision == Decision.EXHAUSTED) {
          LOGGER.log(WARNING, "All {0} attempts failed", attempt);
          if (attempt == 1) throw failure;
          throw new RetryExhaustedException(attempt - 1, failure);
        }

        final var delay = delayForRetry(options, attempt);
        LOGGER.log(
            DEBUG,
            "Attempt {0} failed with {1}, retrying in {2} ms",
            attempt,
            failure.getClass().getName(),
            delay.toMillis());

        if (!delay.isZero()) {
          try {
            sleeper.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw failure;
          }
        }
      }
    }
  }
}

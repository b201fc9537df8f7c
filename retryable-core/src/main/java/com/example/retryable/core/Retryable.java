package com.example.retryable.core;

import com.example.retryable.core.Retry.CallOptions;
import com.example.retryable.core.Retry.Operation;
import com.example.retryable.core.Retry.Policy;
import com.example.retryable.core.Retry.RetryPredicate;
import com.example.retryable.core.Retry.Sleeper;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Operation wrapper that transparently retries failed calls.
 *
 * <p>The wrapped operation keeps its calling convention: {@link #call(Object)} takes the same
 * argument and returns the same result. Retry behavior fixed at wrap time comes from the builder;
 * per-call overrides travel in a separate {@link CallOptions} and are never passed to the operation.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var fetch = Retryable.builder((URI uri) -> client.get(uri))
 *     .maxAttempts(4)
 *     .noRetry(FileNotFoundException.class)
 *     .build();
 *
 * String body = fetch.call(uri);
 * }</pre>
 *
 * <h2>Per-Call Overrides</h2>
 *
 * <pre>{@code
 * String body = fetch.call(uri, Retry.CallOptions.none()
 *     .withMaxAttempts(6)
 *     .withDelay(Duration.ofMillis(500))
 *     .withBackoff(2.0)
 *     .withPredicate(e -> !(e instanceof AccessDeniedException)));
 * }</pre>
 *
 * <p>Instances are immutable and hold no per-call state, so one instance can be shared between
 * threads.
 *
 * @param <A> argument type
 * @param <R> result type
 * @param <E> checked exception type thrown by the operation
 */
public final class Retryable<A, R, E extends Exception> {

  private final Operation<A, R, E> operation;
  private final Policy policy;
  private final Sleeper sleeper;

  private Retryable(
      final Operation<A, R, E> operation, final Policy policy, final Sleeper sleeper) {
    this.operation = operation;
    this.policy = policy;
    this.sleeper = sleeper;
  }

  /**
   * Wraps an operation with the default policy.
   *
   * @param operation operation to wrap
   * @param <A> argument type
   * @param <R> result type
   * @param <E> checked exception type
   * @return retrying wrapper
   */
  public static <A, R, E extends Exception> Retryable<A, R, E> wrap(
      final Operation<A, R, E> operation) {
    return builder(operation).build();
  }

  /**
   * Wraps an operation with the given wrap-time policy.
   *
   * @param operation operation to wrap
   * @param policy wrap-time configuration
   * @param <A> argument type
   * @param <R> result type
   * @param <E> checked exception type
   * @return retrying wrapper
   */
  public static <A, R, E extends Exception> Retryable<A, R, E> wrap(
      final Operation<A, R, E> operation, final Policy policy) {
    return builder(operation).policy(policy).build();
  }

  /**
   * Creates a new builder for the given operation.
   *
   * @param operation operation to wrap
   * @param <A> argument type
   * @param <R> result type
   * @param <E> checked exception type
   * @return new builder
   */
  public static <A, R, E extends Exception> Builder<A, R, E> builder(
      final Operation<A, R, E> operation) {
    return new Builder<>(operation);
  }

  /**
   * Calls the operation, retrying according to the wrap-time policy.
   *
   * @param argument argument forwarded to every attempt
   * @return the first successful result
   * @throws E if the failure is excluded, rejected, or no retry was allowed
   * @throws RetryExhaustedException if retries were performed and all of them failed
   */
  public R call(final A argument) throws E {
    return call(argument, CallOptions.none());
  }

  /**
   * Calls the operation with per-call overrides.
   *
   * @param argument argument forwarded to every attempt
   * @param options overrides for this call only, null for none
   * @return the first successful result
   * @throws E if the failure is excluded, rejected, or no retry was allowed
   * @throws RetryExhaustedException if retries were performed and all of them failed
   */
  public R call(final A argument, final CallOptions options) throws E {
    final var resolved = options == null ? CallOptions.none() : options;
    return Retry.execute(operation, argument, policy, resolved, sleeper);
  }

  /**
   * Returns the wrap-time policy.
   *
   * @return policy
   */
  public Policy policy() {
    return policy;
  }

  /**
   * Builder for {@link Retryable}.
   *
   * <h3>Example</h3>
   *
   * <pre>{@code
   * var save = Retryable.builder(repository::save)
   *     .maxAttempts(5)
   *     .noRetry(ConstraintViolationException.class)
   *     .predicate(e -> e.getMessage() == null || !e.getMessage().contains("read-only"))
   *     .build();
   * }</pre>
   */
  public static final class Builder<A, R, E extends Exception> {
    private final Operation<A, R, E> operation;
    private Integer maxAttempts;
    private final Set<Class<? extends Throwable>> noRetry = new HashSet<>();
    private RetryPredicate predicate;
    private Policy policy;
    private Sleeper sleeper = Sleeper.threadSleep();

    private Builder(final Operation<A, R, E> operation) {
      this.operation = operation;
    }

    /**
     * Sets the total number of attempts, including the first.
     *
     * @param maxAttempts attempts, must be >= 0
     * @return this builder
     */
    public Builder<A, R, E> maxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Adds failure types that are never retried.
     *
     * @param types excluded types, subclasses included
     * @return this builder
     */
    @SafeVarargs
    public final Builder<A, R, E> noRetry(final Class<? extends Throwable>... types) {
      noRetry.addAll(Arrays.asList(types));
      return this;
    }

    /**
     * Sets the default retry predicate; a call-time predicate replaces it.
     *
     * @param predicate retry decision
     * @return this builder
     */
    public Builder<A, R, E> predicate(final RetryPredicate predicate) {
      this.predicate = predicate;
      return this;
    }

    /**
     * Starts from an existing policy. Values set on this builder are applied on top of it.
     *
     * @param policy base policy
     * @return this builder
     */
    public Builder<A, R, E> policy(final Policy policy) {
      this.policy = policy;
      return this;
    }

    Builder<A, R, E> sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Builds the wrapper.
     *
     * @return retrying wrapper
     * @throws IllegalStateException if no operation was given
     * @throws IllegalArgumentException if the attempt count is negative
     */
    public Retryable<A, R, E> build() {
      if (operation == null) throw new IllegalStateException("operation is required");
      if (sleeper == null) throw new IllegalStateException("sleeper is required");

      var resolved = policy == null ? Policy.defaults() : policy;
      if (maxAttempts != null) resolved = resolved.withMaxAttempts(maxAttempts);
      if (!noRetry.isEmpty()) {
        final var merged = new HashSet<>(resolved.noRetry());
        merged.addAll(noRetry);
        resolved = new Policy(resolved.maxAttempts(), merged, resolved.predicate());
      }
      if (predicate != null) resolved = resolved.withPredicate(predicate);

      return new Retryable<>(operation, resolved, sleeper);
    }
  }
}

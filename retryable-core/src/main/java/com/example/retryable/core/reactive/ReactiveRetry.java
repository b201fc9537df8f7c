package com.example.retryable.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.retryable.core.Retry;
import com.example.retryable.core.RetryExhaustedException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive counterpart of {@link Retry}: applies the same exclusion list, predicate, attempt
 * budget and delay schedule to Reactor sources.
 *
 * <p>Retries resubscribe to the source, so the source must be cold (for example built with {@code
 * Mono.defer} or {@code Mono.fromCallable}). Delays between attempts use {@link Mono#delay} and
 * never block a thread. Attempts stay strictly sequential.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Mono<Order> order = ReactiveRetry.retry(
 *     Mono.defer(() -> client.fetchOrder(id)),
 *     Retry.Policy.attempts(4).withNoRetry(OrderNotFoundException.class),
 *     Retry.CallOptions.none().withDelay(Duration.ofMillis(100)).withBackoff(2.0));
 * }</pre>
 *
 * <h2>Plugging Into retryWhen</h2>
 *
 * <pre>{@code
 * flux.retryWhen(ReactiveRetry.toReactorRetry(policy, Retry.CallOptions.none()));
 * }</pre>
 *
 * <p>On exhaustion the error signal is a {@link RetryExhaustedException} wrapping the last failure,
 * unless no retry happened, in which case the original failure is signalled.
 */
public final class ReactiveRetry {

  private static final System.Logger LOGGER = System.getLogger(ReactiveRetry.class.getName());

  private ReactiveRetry() {}

  /**
   * Retries a cold {@link Mono}.
   *
   * @param source source to resubscribe on failure
   * @param policy wrap-time configuration
   * @param options call-time configuration
   * @param <T> element type
   * @return retrying mono
   */
  public static <T> Mono<T> retry(
      final Mono<T> source, final Retry.Policy policy, final Retry.CallOptions options) {
    return source.retryWhen(toReactorRetry(policy, options));
  }

  /**
   * Retries a cold {@link Flux}. Elements emitted before a failure are not replayed by this
   * operator; a resubscription emits whatever the source emits again.
   *
   * @param source source to resubscribe on failure
   * @param policy wrap-time configuration
   * @param options call-time configuration
   * @param <T> element type
   * @return retrying flux
   */
  public static <T> Flux<T> retry(
      final Flux<T> source, final Retry.Policy policy, final Retry.CallOptions options) {
    return source.retryWhen(toReactorRetry(policy, options));
  }

  /**
   * Adapts a policy and call options to a Reactor retry spec.
   *
   * @param policy wrap-time configuration
   * @param options call-time configuration
   * @return Reactor retry spec
   */
  public static reactor.util.retry.Retry toReactorRetry(
      final Retry.Policy policy, final Retry.CallOptions options) {
    final var resolvedOptions = options == null ? Retry.CallOptions.none() : options;
    final var maxAttempts = Retry.maxAttempts(policy, resolvedOptions);
    final var predicate = Retry.predicate(policy, resolvedOptions);

    return reactor.util.retry.Retry.from(
        signals ->
            signals.concatMap(
                signal ->
                    next(
                        signal.failure(),
                        signal.totalRetries() + 1,
                        maxAttempts,
                        policy,
                        predicate,
                        resolvedOptions)));
  }

  private static Mono<Long> next(
      final Throwable failure,
      final long attempt,
      final int maxAttempts,
      final Retry.Policy policy,
      final Retry.RetryPredicate predicate,
      final Retry.CallOptions options) {
    switch (Retry.decide(failure, attempt, maxAttempts, policy, predicate)) {
      case RETRY:
        {
          final var delay = Retry.delayForRetry(options, attempt);
          LOGGER.log(
              DEBUG,
              "Attempt {0} failed with {1}, resubscribing in {2} ms",
              attempt,
              failure.getClass().getName(),
              delay.toMillis());
          return delay.isZero() ? Mono.just(attempt) : Mono.delay(delay).thenReturn(attempt);
        }
      case EXHAUSTED:
        LOGGER.log(WARNING, "All {0} attempts failed", attempt);
        return Mono.error(Retry.exhausted(failure, attempt - 1));
      default:
        return Mono.error(failure);
    }
  }
}

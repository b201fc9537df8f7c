/**
 * Root package for the retryable library.
 *
 * <p>Wraps an operation that may fail so that failed calls are repeated a bounded number of times
 * with a growing delay. Whether a failure is retried depends on an exclusion list of failure types
 * and an optional predicate.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.retryable.core.Retryable} – the wrapper; same calling convention as the
 *       wrapped operation plus optional per-call overrides.
 *   <li>{@link com.example.retryable.core.Retry} – configuration records, the per-failure decision
 *       and the blocking retry loop.
 *   <li>{@link com.example.retryable.core.RetryExhaustedException} – surfaced after the budget is
 *       spent; carries the last failure and the number of retries.
 *   <li>{@link com.example.retryable.core.reactive.ReactiveRetry} – the same rules applied to
 *       Reactor {@code Mono}/{@code Flux} sources with non-blocking delays.
 *   <li>{@link com.example.retryable.core.config.PolicyReader} – reads wrap-time policies from JSON.
 * </ul>
 */
package com.example.retryable.core;

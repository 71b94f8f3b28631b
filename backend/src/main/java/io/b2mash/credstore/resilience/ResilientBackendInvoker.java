package io.b2mash.credstore.resilience;

import io.b2mash.credstore.exception.CredentialStoreException;
import io.b2mash.credstore.exception.PluginUnavailableException;
import io.b2mash.credstore.exception.TransientBackendException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Runs blocking backend calls asynchronously behind a per-attempt timeout, the instance's circuit
 * breaker and a bounded exponential-backoff retry. Only transient failures are retried.
 *
 * <p>Outcomes seen by callers: the backend's value; the backend's own {@link
 * CredentialStoreException} unchanged; or {@link PluginUnavailableException} when the breaker is
 * open or transient failures outlast the retry attempts. A timed-out attempt keeps running in the
 * background, so a write that has already reached the backend is never interrupted half-way.
 */
@Component
public class ResilientBackendInvoker {

  private static final Logger log = LoggerFactory.getLogger(ResilientBackendInvoker.class);

  private final BackendCircuitBreakers circuitBreakers;
  private final RetryRegistry retryRegistry;
  private final TimeLimiter timeLimiter;
  private final int maxAttempts;
  private final ExecutorService backendExecutor;
  private final ScheduledExecutorService scheduler;

  public ResilientBackendInvoker(
      BackendCircuitBreakers circuitBreakers, ResilienceProperties properties) {
    this.circuitBreakers = circuitBreakers;
    this.maxAttempts = properties.maxAttempts();
    this.retryRegistry =
        RetryRegistry.of(
            RetryConfig.custom()
                .maxAttempts(properties.maxAttempts())
                .intervalFunction(
                    IntervalFunction.ofExponentialBackoff(
                        properties.initialBackoff().toMillis(),
                        properties.backoffMultiplier(),
                        properties.maxBackoff().toMillis()))
                .retryOnException(TransientFailures::isTransient)
                .build());
    this.timeLimiter =
        TimeLimiter.of(
            TimeLimiterConfig.custom()
                .timeoutDuration(properties.callTimeout())
                .cancelRunningFuture(false)
                .build());
    this.backendExecutor =
        Executors.newFixedThreadPool(
            properties.executorPoolSize(), new CustomizableThreadFactory("credstore-backend-"));
    this.scheduler =
        Executors.newScheduledThreadPool(2, new CustomizableThreadFactory("credstore-retry-"));
  }

  /**
   * Invokes {@code call} against backend {@code instanceId}.
   *
   * @param operation short name used in logs
   */
  public <T> CompletableFuture<T> invoke(String instanceId, String operation, Supplier<T> call) {
    CircuitBreaker breaker = circuitBreakers.forInstance(instanceId);
    Retry retry = retryRegistry.retry(instanceId);

    Supplier<CompletionStage<T>> attempt =
        () -> timeLimiter.executeCompletionStage(scheduler, () -> submit(instanceId, call));
    Supplier<CompletionStage<T>> guarded = CircuitBreaker.decorateCompletionStage(breaker, attempt);
    Supplier<CompletionStage<T>> retried = Retry.decorateCompletionStage(retry, scheduler, guarded);

    var result = new CompletableFuture<T>();
    retried
        .get()
        .whenComplete(
            (value, error) -> {
              if (error == null) {
                result.complete(value);
              } else {
                result.completeExceptionally(translate(instanceId, operation, error));
              }
            });
    return result;
  }

  @PreDestroy
  public void shutdown() {
    scheduler.shutdownNow();
    backendExecutor.shutdown();
  }

  private <T> CompletableFuture<T> submit(String instanceId, Supplier<T> call) {
    try {
      return CompletableFuture.supplyAsync(call, backendExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new TransientBackendException(instanceId, "Backend executor rejected the call", e));
    }
  }

  private RuntimeException translate(String instanceId, String operation, Throwable error) {
    var cause = TransientFailures.unwrap(error);
    if (cause instanceof CallNotPermittedException) {
      log.debug("Backend {} {} rejected: circuit open", instanceId, operation);
      return new PluginUnavailableException(
          "Backend " + instanceId + " is unavailable (circuit open)", cause);
    }
    if (TransientFailures.isTransient(cause)) {
      String reason = cause instanceof TimeoutException ? "timed out" : "failed";
      log.warn(
          "Backend {} {} {} after {} attempt(s): {}",
          instanceId,
          operation,
          reason,
          maxAttempts,
          cause.getMessage());
      return new PluginUnavailableException(
          "Backend " + instanceId + " " + reason + " after " + maxAttempts + " attempt(s)", cause);
    }
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    return new IllegalStateException("Backend " + instanceId + " " + operation + " failed", cause);
  }
}

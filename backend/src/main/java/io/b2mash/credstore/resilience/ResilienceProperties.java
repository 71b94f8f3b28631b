package io.b2mash.credstore.resilience;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Retry, circuit breaker and timeout settings applied to every backend call.
 *
 * @param failureThreshold consecutive transient failures that open a backend's breaker
 * @param cooldown time a breaker stays open before allowing one trial call
 * @param maxAttempts total attempts per call, including the first
 * @param initialBackoff wait before the first retry
 * @param backoffMultiplier growth factor between retries
 * @param maxBackoff upper bound on a single retry wait
 * @param callTimeout per-attempt timeout; exceeding it counts as a transient failure
 * @param executorPoolSize threads available for blocking backend calls
 */
@Validated
@ConfigurationProperties(prefix = "credstore.resilience")
public record ResilienceProperties(
    @Min(1) @DefaultValue("5") int failureThreshold,
    @NotNull @DefaultValue("30s") Duration cooldown,
    @Min(1) @DefaultValue("3") int maxAttempts,
    @NotNull @DefaultValue("100ms") Duration initialBackoff,
    @DecimalMin("1.0") @DefaultValue("2.0") double backoffMultiplier,
    @NotNull @DefaultValue("1s") Duration maxBackoff,
    @NotNull @DefaultValue("5s") Duration callTimeout,
    @Min(1) @DefaultValue("16") int executorPoolSize) {}

package io.b2mash.credstore.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * One circuit breaker per backend instance. The breaker opens after {@code failureThreshold}
 * consecutive transient failures, rejects calls for {@code cooldown}, then lets exactly one trial
 * call through: success closes it, failure opens it again. Non-transient outcomes (not found,
 * forbidden, validation) count as successful backend responses.
 *
 * <p>State is in-memory and resets on restart. Each instance of this class owns its own registry.
 */
@Component
@EnableConfigurationProperties(ResilienceProperties.class)
public class BackendCircuitBreakers {

  private static final Logger log = LoggerFactory.getLogger(BackendCircuitBreakers.class);

  private final CircuitBreakerRegistry registry;

  public BackendCircuitBreakers(ResilienceProperties properties) {
    // A count-based window of N calls with a 100% failure threshold opens on N consecutive failures
    var config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(properties.failureThreshold())
            .minimumNumberOfCalls(properties.failureThreshold())
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(properties.cooldown())
            .permittedNumberOfCallsInHalfOpenState(1)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .recordException(TransientFailures::isTransient)
            .build();
    this.registry = CircuitBreakerRegistry.of(config);
    registry
        .getEventPublisher()
        .onEntryAdded(
            added ->
                added
                    .getAddedEntry()
                    .getEventPublisher()
                    .onStateTransition(
                        event ->
                            log.warn(
                                "Circuit breaker for backend {}: {}",
                                event.getCircuitBreakerName(),
                                event.getStateTransition())));
  }

  public CircuitBreaker forInstance(String instanceId) {
    return registry.circuitBreaker(instanceId);
  }

  /** False while the instance's breaker is open; a half-open breaker still admits its trial. */
  public boolean isAvailable(String instanceId) {
    var state = forInstance(instanceId).getState();
    return state != CircuitBreaker.State.OPEN && state != CircuitBreaker.State.FORCED_OPEN;
  }

  public CircuitBreaker.State state(String instanceId) {
    return forInstance(instanceId).getState();
  }
}

package com.pmagents.core.worker;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.function.BiConsumer;

/**
 * Builds the per-capability Resilience4j breaker.
 *
 * <p>The count-based window is exactly {@code failureThreshold} calls wide and trips at a
 * 100% failure rate, so the circuit opens after that many consecutive failures. While open
 * it refuses calls for {@code resetTimeout}, then admits a single half-open trial whose
 * outcome closes or reopens it.
 */
public final class CapabilityCircuitBreakers {

    private static final Logger log = LoggerFactory.getLogger(CapabilityCircuitBreakers.class);

    private CapabilityCircuitBreakers() {}

    public static CircuitBreakerConfig config(int failureThreshold, Duration resetTimeout, Duration slowCallCeiling) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100f)
                .waitDurationInOpenState(resetTimeout)
                .permittedNumberOfCallsInHalfOpenState(1)
                // a slow but successful attempt never counts against the worker
                .slowCallRateThreshold(100f)
                .slowCallDurationThreshold(slowCallCeiling)
                .build();
    }

    /**
     * @param slowCallCeiling longer than any attempt can run
     * @param listener        receives every state the breaker enters
     */
    public static CircuitBreaker create(String capability, int failureThreshold, Duration resetTimeout,
                                        Duration slowCallCeiling, Clock clock,
                                        BiConsumer<String, CircuitBreaker.State> listener) {
        var breaker = new CircuitBreakerStateMachine(capability,
                config(failureThreshold, resetTimeout, slowCallCeiling), clock);
        breaker.getEventPublisher().onStateTransition(event -> {
            var transition = event.getStateTransition();
            log.info("Circuit for '{}' {} -> {}", capability, transition.getFromState(), transition.getToState());
            if (listener != null) {
                listener.accept(capability, transition.getToState());
            }
        });
        return breaker;
    }
}

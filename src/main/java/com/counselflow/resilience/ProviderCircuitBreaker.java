package com.counselflow.resilience;

import com.counselflow.config.CounselFlowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider circuit breaker.
 * <p>
 * Each provider has its own state object guarded by its own monitor, so a
 * failing provider never serializes calls to the others. OPEN turns into
 * HALF_OPEN lazily, on the first state read after the timeout. HALF_OPEN lets
 * a single probe through until its outcome is recorded.
 */
@Slf4j
@Component
public class ProviderCircuitBreaker {

    private final Map<String, ProviderState> states = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration timeout;
    private final Clock clock;

    @Autowired
    public ProviderCircuitBreaker(CounselFlowProperties properties) {
        this(properties.getCircuitBreaker().getFailureThreshold(),
                properties.getCircuitBreaker().getTimeout(),
                Clock.systemUTC());
    }

    public ProviderCircuitBreaker(int failureThreshold, Duration timeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Create the breaker for a provider. Registering twice keeps the existing state.
     */
    public void register(String provider) {
        state(provider);
    }

    /**
     * Whether a call may go out now. In HALF_OPEN this claims the single probe slot,
     * so a caller that gets {@code true} must record an outcome or release the probe.
     */
    public boolean canExecute(String provider) {
        return tryAcquire(provider).permitted();
    }

    /**
     * Like {@link #canExecute(String)}, but the returned permit identifies the probe
     * slot it holds, if any, so only that caller can hand it back.
     */
    public BreakerPermit tryAcquire(String provider) {
        ProviderState s = state(provider);
        synchronized (s) {
            advance(provider, s);
            return switch (s.state) {
                case CLOSED -> BreakerPermit.ALLOWED;
                case OPEN -> BreakerPermit.REJECTED;
                case HALF_OPEN -> {
                    if (s.probeInFlight) {
                        yield BreakerPermit.REJECTED;
                    }
                    s.probeInFlight = true;
                    s.probeId = ++s.probeSequence;
                    yield new BreakerPermit(true, s.probeId);
                }
            };
        }
    }

    public void recordSuccess(String provider) {
        ProviderState s = state(provider);
        synchronized (s) {
            CircuitState previous = s.state;
            s.state = CircuitState.CLOSED;
            s.failureCount = 0;
            s.probeInFlight = false;
            if (previous != CircuitState.CLOSED) {
                log.info("Circuit breaker for {} closed after successful call ({} -> CLOSED)", provider, previous);
            }
        }
    }

    public void recordFailure(String provider) {
        ProviderState s = state(provider);
        synchronized (s) {
            advance(provider, s);
            s.failureCount++;
            s.lastFailureTime = clock.instant();
            s.probeInFlight = false;

            if (s.state == CircuitState.HALF_OPEN) {
                s.state = CircuitState.OPEN;
                log.warn("Circuit breaker for {} re-opened: probe call failed", provider);
            } else if (s.state == CircuitState.CLOSED && s.failureCount >= failureThreshold) {
                s.state = CircuitState.OPEN;
                log.warn("Circuit breaker for {} opened after {} consecutive failures", provider, s.failureCount);
            }
        }
    }

    /**
     * Give back a half-open probe slot without recording an outcome (cancelled call).
     * Does nothing unless {@code permit} holds the slot currently in flight.
     */
    public void releaseProbe(String provider, BreakerPermit permit) {
        if (!permit.isProbe()) {
            return;
        }
        ProviderState s = state(provider);
        synchronized (s) {
            if (s.probeInFlight && s.probeId == permit.probeId()) {
                s.probeInFlight = false;
                log.debug("Probe {} for {} released without an outcome", permit.probeId(), provider);
            }
        }
    }

    public CircuitState getState(String provider) {
        ProviderState s = state(provider);
        synchronized (s) {
            advance(provider, s);
            return s.state;
        }
    }

    public BreakerSnapshot snapshot(String provider) {
        ProviderState s = state(provider);
        synchronized (s) {
            advance(provider, s);
            return new BreakerSnapshot(provider, s.state, s.failureCount, s.lastFailureTime,
                    failureThreshold, timeout.toSeconds());
        }
    }

    /**
     * Force a provider back to CLOSED (operator action).
     */
    public void reset(String provider) {
        ProviderState s = state(provider);
        synchronized (s) {
            s.state = CircuitState.CLOSED;
            s.failureCount = 0;
            s.lastFailureTime = null;
            s.probeInFlight = false;
        }
        log.info("Circuit breaker for {} reset", provider);
    }

    private ProviderState state(String provider) {
        return states.computeIfAbsent(provider, p -> new ProviderState());
    }

    // Caller holds the monitor of s
    private void advance(String provider, ProviderState s) {
        if (s.state == CircuitState.OPEN
                && s.lastFailureTime != null
                && !clock.instant().isBefore(s.lastFailureTime.plus(timeout))) {
            s.state = CircuitState.HALF_OPEN;
            s.probeInFlight = false;
            log.info("Circuit breaker for {} half-open, allowing one probe call", provider);
        }
    }

    private static final class ProviderState {
        private CircuitState state = CircuitState.CLOSED;
        private int failureCount;
        private Instant lastFailureTime;
        private boolean probeInFlight;
        private long probeId;
        private long probeSequence;
    }
}

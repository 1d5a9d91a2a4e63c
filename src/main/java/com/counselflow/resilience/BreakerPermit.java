package com.counselflow.resilience;

/**
 * Outcome of asking a breaker for permission to call a provider.
 *
 * @param permitted whether the call may go out
 * @param probeId   id of the half-open probe slot this call holds, 0 when it holds none
 */
public record BreakerPermit(boolean permitted, long probeId) {

    static final BreakerPermit REJECTED = new BreakerPermit(false, 0);
    static final BreakerPermit ALLOWED = new BreakerPermit(true, 0);

    public boolean isProbe() {
        return probeId != 0;
    }
}

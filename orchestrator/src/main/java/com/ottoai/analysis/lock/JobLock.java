package com.ottoai.analysis.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Cross-process mutual exclusion keyed by string.
 *
 * Acquisition never blocks: a held key is reported as an empty result, which
 * callers treat as a normal branch, not an error.
 */
public interface JobLock {

    /**
     * Try once to take the lock.
     *
     * @param ttl the lock expires on its own after this long if never released
     * @return the lease if acquired, empty if someone else holds it
     */
    Optional<LockLease> tryAcquire(String key, Duration ttl);

    /**
     * Release a lease. Releasing an expired lease that someone else has since
     * re-acquired is a no-op.
     *
     * @return true if this lease was still held and is now released
     */
    boolean release(LockLease lease);
}

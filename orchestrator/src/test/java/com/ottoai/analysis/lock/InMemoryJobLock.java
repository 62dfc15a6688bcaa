package com.ottoai.analysis.lock;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-process {@link JobLock} with the same non-blocking semantics as the
 * Redis lock. TTLs are ignored.
 */
public class InMemoryJobLock implements JobLock {

    private final Map<String, String> held = new ConcurrentHashMap<>();
    private final AtomicInteger busyCount = new AtomicInteger();

    @Override
    public Optional<LockLease> tryAcquire(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        if (held.putIfAbsent(key, token) == null) {
            return Optional.of(new LockLease(key, token));
        }
        busyCount.incrementAndGet();
        return Optional.empty();
    }

    @Override
    public boolean release(LockLease lease) {
        return held.remove(lease.key(), lease.token());
    }

    /** Hold a key as if another process owned it. */
    public void holdExternally(String key) {
        held.put(key, "someone-else");
    }

    public boolean isHeld(String key) {
        return held.containsKey(key);
    }

    public int busyCount() {
        return busyCount.get();
    }
}

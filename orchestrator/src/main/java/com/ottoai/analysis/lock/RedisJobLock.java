package com.ottoai.analysis.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link JobLock} on Redis: {@code SET key token NX PX ttl} to acquire,
 * compare-and-delete Lua script to release.
 *
 * Redis being unreachable counts as "not acquired". Completion is redundant
 * (webhook + poller), so skipping is always safe; writing without the lock is not.
 */
@Component
public class RedisJobLock implements JobLock {

    private static final Logger log = LoggerFactory.getLogger(RedisJobLock.class);

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            else
                return 0
            end
            """, Long.class);

    private final StringRedisTemplate redis;

    public RedisJobLock(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<LockLease> tryAcquire(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redis.opsForValue().setIfAbsent(key, token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Lock acquired: {}", key);
                return Optional.of(new LockLease(key, token));
            }
            log.debug("Lock busy: {}", key);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Lock acquisition failed for {}, treating as busy: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean release(LockLease lease) {
        try {
            Long deleted = redis.execute(RELEASE_SCRIPT, List.of(lease.key()), lease.token());
            if (deleted == null || deleted == 0L) {
                // TTL expired before release; the key may now belong to someone else.
                log.warn("Lock {} was no longer held at release", lease.key());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            // Key still expires on its own after the TTL.
            log.error("Lock release failed for {}: {}", lease.key(), e.getMessage());
            return false;
        }
    }
}

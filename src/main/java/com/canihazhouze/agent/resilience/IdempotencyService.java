package com.canihazhouze.agent.resilience;

import com.canihazhouze.agent.support.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for run-async requests.
 *
 * A client that times out and retries an enqueue must not start the same
 * run twice: the first request claims the key with SET NX, and once the run
 * exists the key maps to its run id. Repeats get the existing run back.
 *
 * Key pattern: agent:idempotency:{idempotencyKey}
 * TTL: 24 hours
 *
 * Opt-in: requests without an Idempotency-Key header always enqueue fresh.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "agent:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Stored while the enqueue is in flight
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Run id recorded for this key, if the original request already finished enqueueing.
     */
    public Optional<String> findRunId(String agentId, String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(agentId, idempotencyKey));
        if (existing == null || IN_FLIGHT_SENTINEL.equals(existing)) {
            return Optional.empty();
        }
        log.info("Idempotency hit [agentId={}, key={}]", agentId, LogSanitizer.clean(idempotencyKey));
        return Optional.of(existing);
    }

    /**
     * Mark key as in flight atomically (SET NX).
     * Returns false if another request holds the key.
     */
    public boolean claimKey(String agentId, String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(agentId, idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeRunId(String agentId, String idempotencyKey, String runId) {
        redisTemplate.opsForValue().set(buildKey(agentId, idempotencyKey), runId, TTL);
        log.debug("Stored idempotency mapping key={} runId={}", LogSanitizer.clean(idempotencyKey), runId);
    }

    /**
     * Clean up after a rejected enqueue so the client can retry.
     */
    public void releaseKey(String agentId, String idempotencyKey) {
        redisTemplate.delete(buildKey(agentId, idempotencyKey));
        log.debug("Released idempotency key={}", LogSanitizer.clean(idempotencyKey));
    }

    // Scoped per agent: the same client key may be reused against another agent
    private String buildKey(String agentId, String idempotencyKey) {
        return KEY_PREFIX + agentId + ":" + idempotencyKey;
    }
}

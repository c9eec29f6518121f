package com.meetinganalyzer.ledger.adapter;

import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.ledger.service.ObjectClaimLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

@Component
@ConditionalOnProperty(value = "app.ledger.redis-lock-enabled", havingValue = "true")
public class RedisObjectClaimLock implements ObjectClaimLock {

    private static final Logger log = LoggerFactory.getLogger(RedisObjectClaimLock.class);
    private static final Duration DEFAULT_TTL = Duration.ofHours(2);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration ttl;
    private final String owner = UUID.randomUUID().toString();

    public RedisObjectClaimLock(StringRedisTemplate redisTemplate, AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        String prefix = appProperties.ledger().lockKeyPrefix();
        this.keyPrefix = prefix == null || prefix.isBlank() ? "meetings:claim:" : prefix;
        Duration configuredTtl = appProperties.ledger().lockTtl();
        this.ttl = configuredTtl == null || configuredTtl.isZero() || configuredTtl.isNegative() ? DEFAULT_TTL : configuredTtl;
    }

    @Override
    public boolean tryClaim(String objectId) {
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(keyPrefix + objectId, owner, ttl);
            return Boolean.TRUE.equals(acquired);
        } catch (Exception exception) {
            throw new IllegalStateException("Unable to claim " + objectId, exception);
        }
    }

    @Override
    public void release(String objectId) {
        String key = keyPrefix + objectId;
        try {
            String holder = redisTemplate.opsForValue().get(key);
            if (owner.equals(holder)) {
                redisTemplate.delete(key);
            }
        } catch (Exception exception) {
            log.warn("Unable to release claim on {}; it expires after {}", objectId, ttl, exception);
        }
    }
}

package com.smartfix.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by a Redis hash.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Lookups check the service scope first, then the "global" scope, then fall back
 * to the caller's default. Toggle at runtime:
 *   HSET feature-flags:smartfix auto_match_on_create false
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_SCOPE    = "global";

    public static final String DEFAULT_SCOPE = "smartfix";

    public static final String AUTO_MATCH_ON_CREATE   = "auto_match_on_create";
    public static final String PROVIDER_NOTIFICATIONS = "provider_notifications";

    private final RedisTemplate<String, String> redisTemplate;

    public boolean isEnabled(String scope, String flagName, boolean defaultValue) {
        Object scopedVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
        if (scopedVal != null) {
            return Boolean.parseBoolean(scopedVal.toString());
        }

        Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_SCOPE, flagName);
        if (globalVal != null) {
            return Boolean.parseBoolean(globalVal.toString());
        }

        log.debug("Feature flag '{}' not found for scope='{}', using default={}", flagName, scope, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_SCOPE, flagName, defaultValue);
    }

    /**
     * Seeds defaults without overwriting values already present (called at startup).
     */
    public void initDefaults(String scope) {
        String key = FLAG_KEY_PREFIX + scope;
        setIfAbsent(key, AUTO_MATCH_ON_CREATE,   "true");
        setIfAbsent(key, PROVIDER_NOTIFICATIONS, "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }

    private void setIfAbsent(String key, String field, String value) {
        redisTemplate.opsForHash().putIfAbsent(key, field, value);
    }
}

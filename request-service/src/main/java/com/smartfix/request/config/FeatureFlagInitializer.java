package com.smartfix.request.config;

import com.smartfix.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds default feature flags on startup.
 * Flags already set in Redis are NOT overwritten (putIfAbsent).
 *
 * To toggle a flag at runtime without restart:
 *   redis-cli HSET feature-flags:smartfix auto_match_on_create false
 *   redis-cli HSET feature-flags:smartfix provider_notifications false
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "smartfix.feature-flags.seed-on-startup", havingValue = "true", matchIfMissing = true)
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            featureFlagService.initDefaults(FeatureFlagService.DEFAULT_SCOPE);
            log.info("Feature flags initialised for scope={}", FeatureFlagService.DEFAULT_SCOPE);
        };
    }
}

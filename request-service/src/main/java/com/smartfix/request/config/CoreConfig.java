package com.smartfix.request.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.IdGenerator;
import org.springframework.util.JdkIdGenerator;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time and identity sources. Everything that reads "now" or mints an id takes these
 * beans, so tests can pin both.
 */
@Configuration
public class CoreConfig {

    /**
     * The clock's zone decides which weekday a scheduled date falls on during matching.
     */
    @Bean
    public Clock clock(@Value("${smartfix.matching.zone-id:UTC}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }

    @Bean
    public IdGenerator idGenerator() {
        return new JdkIdGenerator();
    }
}

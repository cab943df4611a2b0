package com.recordguard.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.recordguard.domain.model.GuardedSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * Live sessions, held in a Caffeine cache with idle expiry. An expired
 * session is gone together with its history.
 */
@Configuration
@Slf4j
public class SessionCacheConfiguration {

    @Bean
    public Cache<UUID, GuardedSession> sessionCache(RecordGuardProperties properties) {
        RecordGuardProperties.Session settings = properties.getSession();
        log.info("Configuring session cache: maximumSize={}, idleTimeout={}",
            settings.getMaximumSize(), settings.getIdleTimeout());
        return Caffeine.newBuilder()
            .maximumSize(settings.getMaximumSize())
            .expireAfterAccess(settings.getIdleTimeout())
            .recordStats()
            .build();
    }
}

package com.reprise.config;

import com.reprise.service.CacheKeyGenerator;
import com.reprise.service.ResponseCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.AlternativeJdkIdGenerator;
import org.springframework.util.IdGenerator;

import java.time.Clock;

/**
 * Wires the single response cache instance and its collaborators.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final RepriseProperties properties;

    public CacheConfiguration(RepriseProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdGenerator entryIdGenerator() {
        return new AlternativeJdkIdGenerator();
    }

    @Bean
    public ResponseCacheStore responseCacheStore(
            CacheKeyGenerator keyGenerator,
            Clock clock,
            IdGenerator entryIdGenerator) {
        RepriseProperties.CacheConfig cache = properties.getCache();
        log.info("Initializing response cache (enabled: {}, max entries: {}, max age: {} days)",
                cache.isEnabled(), cache.getMaxEntries(), cache.getMaxAgeDays());
        return new ResponseCacheStore(cache.toSettings(), keyGenerator, clock, entryIdGenerator);
    }
}

package com.al.hl7generator.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-memory caches for the schema definitions and demographic pools.
 *
 * <p>
 * Schemas are immutable classpath resources, so entries never expire. Lookups
 * of missing schemas are cached as well (as null), so a missing resource is
 * only searched for once.
 */
@Configuration
@EnableCaching(proxyTargetClass = true)
public class CacheConfig {

    public static final String TRIGGER_EVENTS = "triggerEvents";
    public static final String SEGMENTS = "segments";
    public static final String DATA_TYPES = "dataTypes";
    public static final String CODE_TABLES = "codeTables";
    public static final String DEMOGRAPHIC_POOLS = "demographicPools";
    public static final String LOCATIONS = "locations";

    @Bean
    public CacheManager cacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(
                TRIGGER_EVENTS, SEGMENTS, DATA_TYPES, CODE_TABLES, DEMOGRAPHIC_POOLS, LOCATIONS);
        cacheManager.setAllowNullValues(true);
        return cacheManager;
    }
}

package com.geons.lookup.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.geons.domain.SliverTool;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Lookup module configuration: properties and the Caffeine cache holding complete sliver tool sets per toolId.
 */
@Configuration
@EnableConfigurationProperties(LookupProperties.class)
public class LookupConfig {

    public static final String SLIVER_TOOL_CACHE = "sliverToolCache";

    @Bean(name = SLIVER_TOOL_CACHE)
    public Cache<String, List<SliverTool>> sliverToolCache(LookupProperties lookupProperties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(lookupProperties.getCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(lookupProperties.getCacheMaxSize())
                .build();
    }
}

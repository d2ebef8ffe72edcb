package com.example.schemacache.config;

import com.example.schemacache.core.SchemaCache;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SchemaCacheProperties.class)
public class SchemaCacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Dedicated pool so blocking loaders never run on the common ForkJoinPool
    @Bean(destroyMethod = "shutdown")
    public ExecutorService metadataLoaderExecutor(SchemaCacheProperties properties) {
        return Executors.newFixedThreadPool(properties.getLoaderThreads());
    }

    @Bean
    public SchemaCache schemaCache(Clock clock, SchemaCacheProperties properties, ExecutorService metadataLoaderExecutor) {
        return new SchemaCache(clock, properties.getDefaultTtl(), metadataLoaderExecutor);
    }
}

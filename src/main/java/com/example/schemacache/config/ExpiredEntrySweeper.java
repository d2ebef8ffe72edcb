package com.example.schemacache.config;

import com.example.schemacache.core.SchemaCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drops expired entries on a timer. Lookups already treat them as misses, so
 * this only frees memory held by keys nobody reads any more.
 */
@Component
@ConditionalOnProperty(prefix = "schema-cache.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpiredEntrySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredEntrySweeper.class);

    private final SchemaCache cache;

    public ExpiredEntrySweeper(SchemaCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${schema-cache.sweep.interval:PT5M}")
    public void sweep() {
        int removed = cache.sweepExpired();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
    }
}

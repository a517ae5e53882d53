package com.streamfirst.querycache.boot;

import com.streamfirst.querycache.domain.CacheExpirationMode;
import com.streamfirst.querycache.domain.CachePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized settings of the query cache, bound from {@code query-cache.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "query-cache")
public class QueryCacheProperties {

    /** Suppresses dependency resolution and invalidation debug output */
    private boolean disableLogging = false;

    /** Policy applied to commands that do not carry their own */
    private DefaultPolicy defaultPolicy = new DefaultPolicy();

    /** Table names per schema owner, seeded into the in-memory schema enumerator */
    private Map<String, List<String>> schemas = new LinkedHashMap<>();

    private Demo demo = new Demo();

    @Getter
    @Setter
    public static class DefaultPolicy {

        private Duration timeout = CachePolicy.DEFAULT_TIMEOUT;

        private CacheExpirationMode expirationMode = CacheExpirationMode.ABSOLUTE;

        /** Explicit dependencies used when a command names no known table */
        private List<String> dependencies = new ArrayList<>();

        public CachePolicy toCachePolicy() {
            return CachePolicy.builder()
                .timeout(timeout)
                .expirationMode(expirationMode)
                .cacheDependencies(dependencies)
                .build();
        }
    }

    @Getter
    @Setter
    public static class Demo {

        /** Runs the read, write, re-read walkthrough on startup */
        private boolean enabled = false;
    }
}

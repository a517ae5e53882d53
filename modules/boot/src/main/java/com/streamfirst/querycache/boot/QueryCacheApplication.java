package com.streamfirst.querycache.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standalone launcher, mainly for the demo walkthrough
 * ({@code --query-cache.demo.enabled=true}).
 */
@SpringBootApplication
public class QueryCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryCacheApplication.class, args);
    }
}

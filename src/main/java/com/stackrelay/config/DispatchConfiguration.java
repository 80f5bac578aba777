package com.stackrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure for the dispatch layer.
 */
@Configuration
public class DispatchConfiguration {

    /**
     * Time source for cache expiry, quota resets and throttling; replaced by a movable clock in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.nosota.mescrow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for every deadline (escrow auto-release, price lock expiry,
 * dispute auto-resolve). Tests replace it with a movable clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

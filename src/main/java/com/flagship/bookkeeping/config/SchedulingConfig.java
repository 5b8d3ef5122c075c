package com.flagship.bookkeeping.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    /**
     * System UTC clock. Posting timestamps and batch references read time from
     * here so tests can pin it.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

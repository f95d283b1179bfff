package com.ledgerly.core.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the UTC clock used for audit timestamps.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock ledgerlyUtcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}

package com.codeops.qr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides the system UTC clock used for token timestamps and health reporting.
 * Tests substitute a fixed or offset clock to exercise expiry.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.flagship.stream_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source for every entry point.
 *
 * Services never call the system clock directly; they read "now" from this
 * bean so that tests can pin and advance time.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

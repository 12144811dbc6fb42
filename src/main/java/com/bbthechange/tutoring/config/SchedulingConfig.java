package com.bbthechange.tutoring.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Supplies the clock the booking engine reads "now" from.
 * Tests replace it with a fixed clock.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock schedulingClock() {
        return Clock.systemUTC();
    }
}

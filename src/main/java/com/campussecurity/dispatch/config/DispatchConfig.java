package com.campussecurity.dispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class DispatchConfig {

    /**
     * Time source for signal timestamps and alert deadlines.
     */
    @Bean
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }
}

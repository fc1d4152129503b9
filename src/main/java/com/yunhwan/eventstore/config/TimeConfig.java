package com.yunhwan.eventstore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {
    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}

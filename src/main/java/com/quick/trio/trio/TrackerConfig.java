package com.quick.trio.trio;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TrackerConfig {

    @Bean
    public Clock trackerClock() {
        return Clock.systemDefaultZone();
    }
}

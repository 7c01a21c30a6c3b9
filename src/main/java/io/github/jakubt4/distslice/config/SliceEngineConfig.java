package io.github.jakubt4.distslice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the slicing pipeline. The {@link Clock} only drives progress
 * reporting inside the rebinning loop and never influences results.
 */
@Configuration
public class SliceEngineConfig {

    @Bean
    Clock sliceClock() {
        return Clock.systemUTC();
    }
}

package com.polkadot.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@SpringBootApplication
@EnableScheduling
public class ParachainAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParachainAnalyticsApplication.class, args);
    }

    // forecast horizons are anchored on this clock
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.flagship.exchange_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock in the business time zone. "Today" for the daily profit aggregate,
 * ledger date filters and the closing date are all derived from it.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock businessClock(@Value("${exchange.business-zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}

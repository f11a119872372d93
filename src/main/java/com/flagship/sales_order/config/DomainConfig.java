package com.flagship.sales_order.config;

import com.flagship.sales_order.kernel.IdGenerator;
import com.flagship.sales_order.kernel.UuidIdGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Collaborators the domain model needs from its environment.
 */
@Configuration
public class DomainConfig {

    /**
     * All domain timestamps are UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdGenerator idGenerator() {
        return new UuidIdGenerator();
    }
}

package com.example.storefront.infrastructure.config;

import com.example.storefront.domain.service.StockLedger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers framework-free domain services as beans.
 */
@Configuration
public class DomainConfig {

    @Bean
    public StockLedger stockLedger() {
        return new StockLedger();
    }
}

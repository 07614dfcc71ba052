package com.flagship.medici_ledger.config;

import com.flagship.medici_ledger.ledger.Ledger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The application works on a single in-memory ledger.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Ledger ledger(LedgerProperties properties) {
        return new Ledger(properties.getName());
    }
}

package com.flagship.bank_account.config;

import com.flagship.bank_account.account.AccountStore;
import com.flagship.bank_account.account.InMemoryAccountStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the account store backing.
 *
 * bank.store.type=jdbc (default) activates JdbcAccountStore;
 * bank.store.type=memory swaps in a non-durable store for demos and local runs.
 */
@Configuration
@Slf4j
public class AccountStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "bank.store.type", havingValue = "memory")
    public AccountStore inMemoryAccountStore() {
        log.warn("Using in-memory account store; balances will not survive a restart");
        return new InMemoryAccountStore();
    }
}

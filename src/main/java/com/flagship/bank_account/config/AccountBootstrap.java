package com.flagship.bank_account.config;

import com.flagship.bank_account.account.Account;
import com.flagship.bank_account.account.AccountStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Seeds the bootstrap account during context startup, before the web server
 * accepts requests. Existing accounts are left untouched.
 */
@Component
@ConditionalOnProperty(name = "bank.bootstrap.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AccountBootstrap {

    private final AccountStore accountStore;

    @Value("${bank.bootstrap.account-id:12345}")
    private String accountId;

    @Value("${bank.bootstrap.initial-balance:100.0}")
    private BigDecimal initialBalance;

    @PostConstruct
    public void ensureBootstrapAccount() {
        boolean created = accountStore.createIfAbsent(Account.of(accountId, initialBalance));
        if (created) {
            log.info("Created bootstrap account {} with balance {}", accountId, initialBalance);
        } else {
            log.info("Bootstrap account {} already exists, skipping", accountId);
        }
    }
}

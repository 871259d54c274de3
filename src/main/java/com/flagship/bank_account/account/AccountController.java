package com.flagship.bank_account.account;

import com.flagship.bank_account.account.dto.AccountResponse;
import com.flagship.bank_account.account.dto.AmountRequest;
import com.flagship.bank_account.account.dto.OpenAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter for account operations.
 *
 * Holds no business rules: it parses the request, calls {@link AccountService}
 * and renders the result. Failed results are unwrapped with
 * {@link AccountResult#orElseThrow()} and rendered by GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<AccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        log.info("Received open account request: id={}", request.getId());
        Account account = accountService.openAccount(request.getId(), request.getInitialBalance())
            .orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") String id) {
        Account account = accountService.balance(id).orElseThrow();
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    @PostMapping("/{id}/deposit")
    public ResponseEntity<AccountResponse> deposit(@PathVariable("id") String id,
                                                   @Valid @RequestBody AmountRequest request) {
        log.info("Received deposit request: id={}, amount={}", id, request.getAmount());
        Account account = accountService.deposit(id, request.getAmount()).orElseThrow();
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    @PostMapping("/{id}/withdraw")
    public ResponseEntity<AccountResponse> withdraw(@PathVariable("id") String id,
                                                    @Valid @RequestBody AmountRequest request) {
        log.info("Received withdrawal request: id={}, amount={}", id, request.getAmount());
        Account account = accountService.withdraw(id, request.getAmount()).orElseThrow();
        return ResponseEntity.ok(AccountResponse.from(account));
    }
}

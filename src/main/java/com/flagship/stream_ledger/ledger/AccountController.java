package com.flagship.stream_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of derived ledger balances.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final LedgerService ledgerService;

    @GetMapping("/{owner}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("owner") String owner) {
        return ResponseEntity.ok(new BalanceResponse(owner, ledgerService.getBalance(owner)));
    }

    @Value
    public static class BalanceResponse {
        @JsonProperty("owner")
        String owner;

        @JsonProperty("balance")
        long balance;
    }
}

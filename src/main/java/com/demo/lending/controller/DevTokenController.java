package com.demo.lending.controller;

import com.demo.lending.controller.dto.AdminDtos.GrantRequest;
import com.demo.lending.service.token.InMemoryTokenLedger;
import com.demo.lending.service.token.TokenCallResult;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigInteger;
import java.util.Map;

/**
 * Funding and allowances for the in-memory token ledger, so deposits can be exercised
 * without a chain. Absent in web3 mode.
 */
@RestController
@RequestMapping(value = "/api/dev/tokens", consumes = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "lending.token-ledger", name = "mode", havingValue = "memory", matchIfMissing = true)
public class DevTokenController {

    private final InMemoryTokenLedger ledger;

    public DevTokenController(InMemoryTokenLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping("/{token}/airdrop")
    public Map<String, Object> airdrop(@PathVariable String token, @Valid @RequestBody GrantRequest req) {
        check(ledger.mint(token, req.owner, positive(req.amount)));
        return Map.of("ok", true, "token", token, "owner", req.owner,
                "balance", ledger.balanceOf(token, req.owner).orElse(BigInteger.ZERO));
    }

    /** Approves the pool custody address as spender for {@code owner}. */
    @PostMapping("/{token}/approve")
    public Map<String, Object> approve(@PathVariable String token, @Valid @RequestBody GrantRequest req) {
        check(ledger.approve(token, req.owner, ledger.spender(), positive(req.amount)));
        return Map.of("ok", true, "token", token, "owner", req.owner,
                "allowance", ledger.allowance(token, req.owner, ledger.spender()));
    }

    private static BigInteger positive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "amount must be positive");
        }
        return amount;
    }

    private static void check(TokenCallResult result) {
        if (!result.success()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, result.reason());
        }
    }
}

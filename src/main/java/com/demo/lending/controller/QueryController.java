package com.demo.lending.controller;

import com.demo.lending.repository.AccountSnapshot;
import com.demo.lending.repository.MintLogEntry;
import com.demo.lending.service.PoolQueryService;
import com.demo.lending.service.PoolQueryService.StableTokenView;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/** Read-only endpoints over the ledger, token registry and mint log. */
@RestController
@RequestMapping("/api")
public class QueryController {

    private final PoolQueryService queries;

    public QueryController(PoolQueryService queries) {
        this.queries = queries;
    }

    @GetMapping("/users")
    public List<String> users() {
        return queries.users();
    }

    @GetMapping("/users/{user}")
    public AccountSnapshot account(@PathVariable String user) {
        return queries.account(user).orElseThrow(() -> notFound("user " + user));
    }

    @GetMapping("/users/{user}/username")
    public Map<String, String> username(@PathVariable String user) {
        String name = queries.username(user).orElseThrow(() -> notFound("user " + user));
        return Map.of("user", user, "username", name);
    }

    @GetMapping("/users/{user}/balances")
    public Map<String, BigInteger> balances(@PathVariable String user) {
        return account(user).balances();
    }

    @GetMapping("/users/{user}/collateral")
    public Map<String, BigInteger> collateral(@PathVariable String user) {
        return account(user).collateral();
    }

    @GetMapping("/users/{user}/borrowed")
    public Map<String, BigInteger> borrowed(@PathVariable String user) {
        return account(user).borrowed();
    }

    @GetMapping("/tokens")
    public List<String> tokens() {
        return queries.supportedTokens();
    }

    @GetMapping("/tokens/{token}/supply")
    public Map<String, Object> supply(@PathVariable String token) {
        return Map.of("token", token, "totalSupply", queries.totalSupply(token));
    }

    @GetMapping("/tokens/{token}/stable")
    public StableTokenView stable(@PathVariable String token) {
        return queries.stableToken(token);
    }

    /** Balance on the token ledger itself, not the pool's bookkeeping. */
    @GetMapping("/tokens/{token}/balance/{owner}")
    public Map<String, Object> externalBalance(@PathVariable String token, @PathVariable String owner) {
        BigInteger balance = queries.externalBalance(token, owner)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_GATEWAY,
                        "balance unavailable for " + token));
        return Map.of("token", token, "owner", owner, "balance", balance);
    }

    @GetMapping("/mints")
    public List<MintLogEntry> mints() {
        return queries.mintLog();
    }

    @GetMapping("/mints/{user}")
    public List<MintLogEntry> mints(@PathVariable String user) {
        return queries.mintLog(user);
    }

    @GetMapping("/version")
    public Map<String, String> version() {
        return Map.of("version", queries.version());
    }

    private static ResponseStatusException notFound(String what) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, what + " not found");
    }
}

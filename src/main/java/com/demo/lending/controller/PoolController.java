package com.demo.lending.controller;

import com.demo.lending.config.WebConfig;
import com.demo.lending.controller.dto.PoolDtos.AmountRequest;
import com.demo.lending.controller.dto.PoolDtos.SignupRequest;
import com.demo.lending.service.LendingPoolService;
import com.demo.lending.service.OperationResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/** Pool operations; the caller is identified by the {@code X-User-Id} header. */
@RestController
@RequestMapping(value = "/api/pool", consumes = MediaType.APPLICATION_JSON_VALUE)
public class PoolController {

    private final LendingPoolService pool;

    public PoolController(LendingPoolService pool) {
        this.pool = pool;
    }

    @PostMapping("/signup")
    public OperationResult signup(@RequestHeader(WebConfig.CALLER_HEADER) String user,
                                  @Valid @RequestBody SignupRequest req) {
        return pool.signup(caller(user), req.username.trim());
    }

    @PostMapping("/deposit")
    public OperationResult deposit(@RequestHeader(WebConfig.CALLER_HEADER) String user,
                                   @Valid @RequestBody AmountRequest req) {
        return pool.deposit(caller(user), req.token, req.amount);
    }

    @PostMapping("/collateral")
    public OperationResult depositCollateral(@RequestHeader(WebConfig.CALLER_HEADER) String user,
                                             @Valid @RequestBody AmountRequest req) {
        return pool.depositCollateral(caller(user), req.token, req.amount);
    }

    @PostMapping("/borrow")
    public OperationResult borrow(@RequestHeader(WebConfig.CALLER_HEADER) String user,
                                  @Valid @RequestBody AmountRequest req) {
        return pool.borrow(caller(user), req.token, req.amount);
    }

    @PostMapping("/repay")
    public OperationResult repay(@RequestHeader(WebConfig.CALLER_HEADER) String user,
                                 @Valid @RequestBody AmountRequest req) {
        return pool.repay(caller(user), req.token, req.amount);
    }

    @PostMapping("/collateral/withdraw")
    public OperationResult withdrawCollateral(@RequestHeader(WebConfig.CALLER_HEADER) String user,
                                              @Valid @RequestBody AmountRequest req) {
        return pool.withdrawCollateral(caller(user), req.token, req.amount);
    }

    static String caller(String header) {
        if (header == null || header.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, WebConfig.CALLER_HEADER + " required");
        }
        return header.trim();
    }
}

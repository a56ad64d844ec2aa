package com.demo.lending.controller;

import com.demo.lending.config.WebConfig;
import com.demo.lending.controller.dto.PoolDtos.AmountRequest;
import com.demo.lending.service.CrowdfundingService;
import com.demo.lending.service.OperationResult;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

@RestController
@RequestMapping("/api/crowdfund")
public class CrowdfundController {

    private final CrowdfundingService crowdfunding;

    public CrowdfundController(CrowdfundingService crowdfunding) {
        this.crowdfunding = crowdfunding;
    }

    @PostMapping(value = "/contribute", consumes = MediaType.APPLICATION_JSON_VALUE)
    public OperationResult contribute(@RequestHeader(WebConfig.CALLER_HEADER) String user,
                                      @Valid @RequestBody AmountRequest req) {
        return crowdfunding.contribute(PoolController.caller(user), req.token, req.amount);
    }

    @GetMapping("/funds")
    public Map<String, BigInteger> funds() {
        return crowdfunding.funds();
    }

    @GetMapping("/contributors/{user}")
    public Map<String, BigInteger> contributions(@PathVariable String user) {
        return crowdfunding.contributions(user);
    }
}

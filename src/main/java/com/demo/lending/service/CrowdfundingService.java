package com.demo.lending.service;

import com.demo.lending.repository.CrowdfundRepository;
import com.demo.lending.repository.MintLogRepository;
import com.demo.lending.repository.TokenRegistry;
import com.demo.lending.service.token.TokenCallResult;
import com.demo.lending.service.token.TokenLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Map;

/** Contribution pool; shares only the mint path and mint log with the lending ledger. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrowdfundingService {

    static final String OP_CONTRIBUTE = "contribute_crowdfund";

    private final CrowdfundRepository crowdfund;
    private final TokenLedger tokenLedger;
    private final TokenRegistry tokenRegistry;
    private final MintLogRepository mintLog;

    /**
     * Records the contribution, then mints to the contributor. A failed mint leaves the
     * contribution in place and is reported on the result.
     */
    public OperationResult contribute(String user, String token, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            return OperationResult.rejected(OP_CONTRIBUTE, FailureReason.POLICY_VIOLATION, "Amount must be positive");
        }
        if (!tokenRegistry.isSupported(token)) {
            return OperationResult.rejected(OP_CONTRIBUTE, FailureReason.NOT_FOUND, "Unsupported token: " + token);
        }

        BigInteger total = crowdfund.contribute(user, token, amount);
        log.info("Crowdfund contribution: {} {} from {} (pool total {})", amount, token, user, total);

        TokenCallResult minted = tokenLedger.mint(token, user, amount);
        if (!minted.success()) {
            log.warn("Crowdfund mint of {} {} to {} failed: {}", amount, token, user, minted.reason());
            return OperationResult.committedWithWarning(OP_CONTRIBUTE, FailureReason.EXTERNAL_CALL_FAILURE,
                    "Contribution recorded; mint failed: " + minted.reason());
        }
        mintLog.append(user, token, amount);
        return OperationResult.committed(OP_CONTRIBUTE, "Contributed " + amount + " " + token);
    }

    public Map<String, BigInteger> funds() {
        return crowdfund.funds();
    }

    public Map<String, BigInteger> contributions(String user) {
        return crowdfund.contributions(user);
    }
}

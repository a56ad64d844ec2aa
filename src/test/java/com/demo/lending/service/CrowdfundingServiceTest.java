package com.demo.lending.service;

import com.demo.lending.config.LendingProperties;
import com.demo.lending.repository.CrowdfundRepository;
import com.demo.lending.repository.MintLogRepository;
import com.demo.lending.repository.TokenRegistry;
import com.demo.lending.service.token.TokenCallResult;
import com.demo.lending.service.token.TokenLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrowdfundingServiceTest {

    @Mock
    private TokenLedger tokenLedger;

    private MintLogRepository mintLog;
    private CrowdfundingService crowdfunding;

    @BeforeEach
    void setUp() {
        LendingProperties props = new LendingProperties();
        props.setTokens(Map.of("ICP", "memory:ICP"));
        mintLog = new MintLogRepository();
        crowdfunding = new CrowdfundingService(new CrowdfundRepository(), tokenLedger, new TokenRegistry(props), mintLog);
    }

    @Test
    void contributionIsPooledAndMinted() {
        when(tokenLedger.mint("ICP", "alice", BigInteger.TEN)).thenReturn(TokenCallResult.ok());

        OperationResult result = crowdfunding.contribute("alice", "ICP", BigInteger.TEN);

        assertThat(result.ok()).isTrue();
        assertThat(result.reason()).isNull();
        assertThat(crowdfunding.funds()).containsEntry("ICP", BigInteger.TEN);
        assertThat(crowdfunding.contributions("alice")).containsEntry("ICP", BigInteger.TEN);
        assertThat(mintLog.byUser("alice")).hasSize(1);
    }

    @Test
    void failedMintKeepsContributionAndWarns() {
        when(tokenLedger.mint("ICP", "alice", BigInteger.TEN)).thenReturn(TokenCallResult.failed("rpc down"));

        OperationResult result = crowdfunding.contribute("alice", "ICP", BigInteger.TEN);

        assertThat(result.ok()).isTrue();
        assertThat(result.reason()).isEqualTo(FailureReason.EXTERNAL_CALL_FAILURE);
        assertThat(result.message()).contains("rpc down");
        assertThat(crowdfunding.funds()).containsEntry("ICP", BigInteger.TEN);
        assertThat(mintLog.all()).isEmpty();
    }

    @Test
    void unknownTokenAndNonPositiveAmountAreRejected() {
        assertThat(crowdfunding.contribute("alice", "DOGE", BigInteger.ONE).reason()).isEqualTo(FailureReason.NOT_FOUND);
        assertThat(crowdfunding.contribute("alice", "ICP", BigInteger.ZERO).reason())
                .isEqualTo(FailureReason.POLICY_VIOLATION);
        assertThat(crowdfunding.funds()).isEmpty();
        verifyNoInteractions(tokenLedger);
    }
}

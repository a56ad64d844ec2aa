package com.demo.lending.service;

import com.demo.lending.repository.TokenRegistry;
import com.demo.lending.service.risk.RiskServiceEndpoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/** Overwrite-style settings: the risk service address and supported tokens. */
@Service
@RequiredArgsConstructor
public class AdminService {

    private final RiskServiceEndpoint riskServiceEndpoint;
    private final TokenRegistry tokenRegistry;

    public void setRiskServiceAddress(String address) {
        riskServiceEndpoint.set(address);
    }

    /** @return true if the token is new */
    public boolean registerToken(String token, String contractAddress) {
        if (!StringUtils.hasText(token) || !StringUtils.hasText(contractAddress)) {
            throw new IllegalArgumentException("token and contract address are required");
        }
        return tokenRegistry.register(token.trim(), contractAddress.trim());
    }
}

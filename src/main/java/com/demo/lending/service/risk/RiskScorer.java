package com.demo.lending.service.risk;

import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;

/** Model behind the built-in {@code /risk} endpoint. */
public interface RiskScorer {
    RiskResponse score(RiskRequest request);

    String version();
}

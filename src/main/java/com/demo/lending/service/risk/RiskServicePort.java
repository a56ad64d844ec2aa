package com.demo.lending.service.risk;

import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;

public interface RiskServicePort {
    RiskResponse assess(String baseUrl, RiskRequest request) throws Exception;
}

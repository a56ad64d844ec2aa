package com.demo.lending.service.risk;

import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RiskServiceClientTest {

    private MockRestServiceServer server;
    private RiskServiceClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RiskServiceClient(restTemplate);
    }

    private static RiskRequest request() {
        return new RiskRequest(BigInteger.valueOf(150), BigInteger.valueOf(100), BigInteger.ZERO, 10,
                BigInteger.valueOf(700));
    }

    @Test
    void postsSnakeCaseRequestAndReadsVerdict() {
        server.expect(requestTo("http://risk.local/risk"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.collateral").value(150))
                .andExpect(jsonPath("$.volatility").value(10))
                .andExpect(jsonPath("$.credit_score").value(700))
                .andRespond(withSuccess("{\"risk_score\":0,\"advice\":\"Safe to borrow\"}",
                        MediaType.APPLICATION_JSON));

        RiskResponse response = client.assess("http://risk.local", request());

        assertThat(response.getRiskScore()).isZero();
        assertThat(response.getAdvice()).isEqualTo("Safe to borrow");
        assertThat(response.getProbability()).isNull();
        server.verify();
    }

    @Test
    void serverErrorPropagates() {
        server.expect(requestTo("http://risk.local/risk")).andRespond(withServerError());

        assertThatThrownBy(() -> client.assess("http://risk.local", request()))
                .isInstanceOf(HttpServerErrorException.class);
    }
}

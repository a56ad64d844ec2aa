package com.demo.lending.service.risk;

import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/** Calls {@code POST {baseUrl}/risk} on the external Risk Service. */
@Service
@RequiredArgsConstructor
public class RiskServiceClient implements RiskServicePort {

    private final RestTemplate restTemplate;

    @Override
    public RiskResponse assess(String baseUrl, RiskRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<RiskResponse> resp = restTemplate.postForEntity(
                baseUrl + "/risk", new HttpEntity<>(request, headers), RiskResponse.class);
        return resp.getBody();
    }
}

package com.demo.lending.service.risk;

import com.demo.lending.config.LendingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Where the risk gate sends its requests; empty until configured. */
@Slf4j
@Component
public class RiskServiceEndpoint {

    private final AtomicReference<String> baseUrl = new AtomicReference<>();

    public RiskServiceEndpoint(LendingProperties props) {
        String configured = props.getRisk().getBaseUrl();
        if (StringUtils.hasText(configured)) {
            set(configured);
        }
    }

    public void set(String url) {
        if (!StringUtils.hasText(url) || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new IllegalArgumentException("Risk service address must be an http(s) URL: " + url);
        }
        String normalized = url.trim().endsWith("/") ? url.trim().substring(0, url.trim().length() - 1) : url.trim();
        String previous = baseUrl.getAndSet(normalized);
        log.info("Risk service address set to {} (was {})", normalized, previous);
    }

    public Optional<String> current() {
        return Optional.ofNullable(baseUrl.get());
    }
}

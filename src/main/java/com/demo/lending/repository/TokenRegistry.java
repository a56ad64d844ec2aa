package com.demo.lending.repository;

import com.demo.lending.config.LendingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Supported tokens in registration order, each mapped to its external contract address. */
@Slf4j
@Component
public class TokenRegistry {

    private final Map<String, String> tokens = new LinkedHashMap<>();

    public TokenRegistry(LendingProperties props) {
        props.getTokens().forEach(this::register);
    }

    /** @return true when the token was not registered before */
    public synchronized boolean register(String token, String contractAddress) {
        String previous = tokens.put(token, contractAddress);
        if (previous == null) {
            log.info("Registered token {} at {}", token, contractAddress);
        } else if (!previous.equals(contractAddress)) {
            log.info("Token {} moved from {} to {}", token, previous, contractAddress);
        }
        return previous == null;
    }

    public synchronized boolean isSupported(String token) {
        return token != null && tokens.containsKey(token);
    }

    public synchronized Optional<String> address(String token) {
        return Optional.ofNullable(tokens.get(token));
    }

    public synchronized List<String> supportedTokens() {
        return new ArrayList<>(tokens.keySet());
    }
}

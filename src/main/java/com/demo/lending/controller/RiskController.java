package com.demo.lending.controller;

import com.demo.lending.service.dto.RiskRequest;
import com.demo.lending.service.dto.RiskResponse;
import com.demo.lending.service.risk.RiskScorer;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Built-in risk service; the pool's gate can be pointed at this application itself. */
@RestController
@RequestMapping("/risk")
public class RiskController {

    private final RiskScorer scorer;

    public RiskController(RiskScorer scorer) {
        this.scorer = scorer;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public RiskResponse assess(@Valid @RequestBody RiskRequest req) {
        return scorer.score(req);
    }

    @GetMapping("/version")
    public Map<String, String> version() {
        return Map.of("version", scorer.version());
    }
}

package com.demo.lending.controller;

import com.demo.lending.controller.dto.AdminDtos.AddressRequest;
import com.demo.lending.service.AdminService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping(value = "/api/admin", consumes = MediaType.APPLICATION_JSON_VALUE)
public class AdminController {

    private final AdminService admin;

    public AdminController(AdminService admin) {
        this.admin = admin;
    }

    /** Points the risk gate at a new service; a malformed URL answers 400. */
    @PutMapping("/risk-service")
    public Map<String, Object> setRiskService(@Valid @RequestBody AddressRequest req) {
        admin.setRiskServiceAddress(req.address.trim());
        return Map.of("ok", true, "riskService", req.address.trim());
    }

    @PutMapping("/tokens/{token}")
    public Map<String, Object> registerToken(@PathVariable String token, @Valid @RequestBody AddressRequest req) {
        boolean added = admin.registerToken(token, req.address);
        return Map.of("ok", true, "token", token, "address", req.address.trim(), "added", added);
    }
}
